package fun.fengwk.rp.core.service.plain;

import fun.fengwk.rp.core.service.plain.model.ContentElement;
import fun.fengwk.rp.core.service.plain.model.ContentNode;
import fun.fengwk.rp.core.service.plain.model.ContentText;
import fun.fengwk.rp.core.service.plain.parser.TextNormalizer;
import fun.fengwk.rp.core.service.plain.support.ContentTreeUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites a content tree into its plain canonical form.
 *
 * <p>Leaf blocks are reduced to a single normalized text child, text is normalized, non-printing text is
 * emptied and every other element keeps its markup while its children are rewritten. Digests are attached
 * level by level as the recursion unwinds, indexes in one pass over the finished tree.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class PlainTreeRewriter {

    private final TextNormalizer textNormalizer;
    private final ContentDigester contentDigester;
    private final NodeIndexer nodeIndexer;

    /**
     * Rewrites the sibling sequence; elements are modified in place.
     */
    public List<ContentNode> rewrite(List<? extends ContentNode> nodes, boolean contentDigests, boolean nodeIndexes) {
        Map<ContentNode, String> digestMemo = contentDigests ? new IdentityHashMap<>() : null;
        List<ContentNode> rewritten = rewriteLevel(nodes, contentDigests, digestMemo);
        if (nodeIndexes) {
            nodeIndexer.attachAll(rewritten);
        }
        return rewritten;
    }

    private List<ContentNode> rewriteLevel(
        List<? extends ContentNode> nodes,
        boolean contentDigests,
        Map<ContentNode, String> digestMemo
    ) {
        List<ContentNode> rewritten = new ArrayList<>(nodes.size());
        for (ContentNode node : nodes) {
            rewritten.add(rewriteNode(node, contentDigests, digestMemo));
        }
        if (contentDigests) {
            for (ContentNode node : rewritten) {
                contentDigester.attach(node, digestMemo);
            }
        }
        return rewritten;
    }

    private ContentNode rewriteNode(ContentNode node, boolean contentDigests, Map<ContentNode, String> digestMemo) {
        if (NodeClassifier.isLeafBlock(node)) {
            ContentElement element = (ContentElement) node;
            String plainText = textNormalizer.normalize(ContentTreeUtils.visibleText(element));
            element.clearChildren();
            if (!plainText.isEmpty()) {
                element.appendChild(ContentText.plain(plainText));
            }
            return element;
        }
        if (NodeClassifier.isText(node)) {
            ContentText text = (ContentText) node;
            if (NodeClassifier.isNonPrinting(text)) {
                // keep the marker, drop its payload
                return text.withText("");
            }
            return ContentText.plain(textNormalizer.normalize(text.text()));
        }
        ContentElement element = (ContentElement) node;
        element.replaceChildren(rewriteLevel(element.children(), contentDigests, digestMemo));
        return element;
    }

}
