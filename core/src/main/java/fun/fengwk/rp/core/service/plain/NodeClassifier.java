package fun.fengwk.rp.core.service.plain;

import fun.fengwk.rp.core.service.plain.model.ContentElement;
import fun.fengwk.rp.core.service.plain.model.ContentNode;
import fun.fengwk.rp.core.service.plain.model.ContentText;

import java.util.Set;

/**
 * Pure predicates over content nodes.
 *
 * @author fengwk
 */
public final class NodeClassifier {

    /**
     * Elements flattened to their plain text by the rewriter.
     */
    public static final Set<String> LEAF_BLOCK_TAGS = Set.of("p", "li");

    private NodeClassifier() {
    }

    public static boolean isLeafBlock(ContentNode node) {
        return node instanceof ContentElement element && LEAF_BLOCK_TAGS.contains(element.tagName());
    }

    public static boolean isText(ContentNode node) {
        return node instanceof ContentText;
    }

    public static boolean isNonPrinting(ContentNode node) {
        return node instanceof ContentText text && !text.textKind().isPrinting();
    }

}
