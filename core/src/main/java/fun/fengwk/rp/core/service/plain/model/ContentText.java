package fun.fengwk.rp.core.service.plain.model;

import java.util.Objects;

/**
 * Immutable text node.
 *
 * @author fengwk
 */
public record ContentText(TextKind textKind, String text) implements ContentNode {

    public ContentText {
        Objects.requireNonNull(textKind, "textKind");
        text = text == null ? "" : text;
    }

    public static ContentText plain(String text) {
        return new ContentText(TextKind.PLAIN, text);
    }

    public static ContentText comment(String text) {
        return new ContentText(TextKind.COMMENT, text);
    }

    public static ContentText cdata(String text) {
        return new ContentText(TextKind.CDATA, text);
    }

    /**
     * Returns a text node of the same kind holding the given payload.
     */
    public ContentText withText(String newText) {
        return new ContentText(textKind, newText);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEXT;
    }

}
