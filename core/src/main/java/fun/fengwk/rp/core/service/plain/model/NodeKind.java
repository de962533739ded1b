package fun.fengwk.rp.core.service.plain.model;

/**
 * Kinds of nodes in a content tree.
 *
 * @author fengwk
 */
public enum NodeKind {

    ELEMENT,
    TEXT

}
