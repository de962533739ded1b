package fun.fengwk.rp.core.service.plain.model;

/**
 * A node of a content tree, either a {@link ContentElement} or a {@link ContentText}.
 *
 * @author fengwk
 */
public interface ContentNode {

    NodeKind kind();

    default boolean isElement() {
        return kind() == NodeKind.ELEMENT;
    }

    default boolean isText() {
        return kind() == NodeKind.TEXT;
    }

}
