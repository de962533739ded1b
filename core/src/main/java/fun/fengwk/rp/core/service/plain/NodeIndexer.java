package fun.fengwk.rp.core.service.plain;

import fun.fengwk.rp.core.service.plain.model.ContentElement;
import fun.fengwk.rp.core.service.plain.model.ContentNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assigns dotted hierarchical position indexes to elements.
 *
 * @author fengwk
 */
@Component
public class NodeIndexer {

    public static final String NODE_INDEX_ATTR = "data-node-index";

    public static final String ROOT_INDEX = "0";

    /**
     * Indexes every root separately, so each top-level element starts again at {@value #ROOT_INDEX}.
     */
    public List<ContentNode> attachAll(List<ContentNode> roots) {
        for (ContentNode root : roots) {
            attach(root, ROOT_INDEX);
        }
        return roots;
    }

    public ContentNode attach(ContentNode node) {
        return attach(node, ROOT_INDEX);
    }

    public ContentNode attach(ContentNode node, String nodeIndex) {
        if (!(node instanceof ContentElement element)) {
            return node;
        }
        element.attr(NODE_INDEX_ATTR, nodeIndex);
        // text children are not numbered
        int localIndex = 0;
        for (ContentNode child : element.children()) {
            if (child instanceof ContentElement) {
                localIndex++;
                attach(child, nodeIndex + "." + localIndex);
            }
        }
        return element;
    }

}
