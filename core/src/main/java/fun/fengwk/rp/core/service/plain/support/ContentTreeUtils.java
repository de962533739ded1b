package fun.fengwk.rp.core.service.plain.support;

import fun.fengwk.rp.core.service.plain.model.ContentElement;
import fun.fengwk.rp.core.service.plain.model.ContentNode;
import fun.fengwk.rp.core.service.plain.model.ContentText;
import fun.fengwk.rp.core.service.plain.model.TextKind;

import java.util.ArrayList;
import java.util.List;

/**
 * @author fengwk
 */
public final class ContentTreeUtils {

    private ContentTreeUtils() {
    }

    /**
     * Concatenates every plain text payload below the node in document order.
     * Comments and CDATA sections are not visible text.
     */
    public static String visibleText(ContentNode node) {
        StringBuilder builder = new StringBuilder();
        appendVisibleText(builder, node);
        return builder.toString();
    }

    private static void appendVisibleText(StringBuilder builder, ContentNode node) {
        if (node instanceof ContentText text) {
            if (text.textKind() == TextKind.PLAIN) {
                builder.append(text.text());
            }
            return;
        }
        for (ContentNode child : ((ContentElement) node).children()) {
            appendVisibleText(builder, child);
        }
    }

    public static List<ContentNode> deepCopy(List<? extends ContentNode> nodes) {
        List<ContentNode> copies = new ArrayList<>(nodes.size());
        for (ContentNode node : nodes) {
            copies.add(deepCopy(node));
        }
        return copies;
    }

    public static ContentNode deepCopy(ContentNode node) {
        if (node instanceof ContentText) {
            return node;
        }
        ContentElement element = (ContentElement) node;
        return new ContentElement(element.tagName(), element.attributes(), deepCopy(element.children()));
    }

}
