package fun.fengwk.rp.core.service.plain;

import fun.fengwk.rp.core.service.plain.model.ContentElement;
import fun.fengwk.rp.core.service.plain.model.ContentNode;
import fun.fengwk.rp.core.service.plain.model.ContentText;
import fun.fengwk.rp.core.service.plain.model.TextBlock;
import fun.fengwk.rp.core.service.plain.parser.TextNormalizer;
import fun.fengwk.rp.core.service.plain.support.ContentTreeUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flattens a content tree into an ordered list of text blocks.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class TextBlockExtractor {

    private static final Set<String> LIST_TAGS = Set.of("ul", "ol");

    private static final String LIST_ITEM_TAG = "li";

    private static final String PARAGRAPH_TAG = "p";

    /**
     * Stands in for the parent of root text nodes.
     */
    private static final String FRAGMENT_TAG = "#fragment";

    private final TextNormalizer textNormalizer;

    /**
     * Lists every text node in document order with its raw payload, whitespace and comments included.
     */
    public List<TextBlock> extractRaw(List<? extends ContentNode> nodes) {
        List<TextBlock> blocks = new ArrayList<>();
        collectRaw(nodes, blocks);
        return blocks;
    }

    private void collectRaw(List<? extends ContentNode> nodes, List<TextBlock> blocks) {
        for (ContentNode node : nodes) {
            if (node instanceof ContentText text) {
                blocks.add(TextBlock.builder().text(text.text()).build());
            } else {
                collectRaw(((ContentElement) node).children(), blocks);
            }
        }
    }

    /**
     * Lists, for every text node in document order, the normalized text of the element holding it. An element
     * holding several text nodes is listed once per text node, a root text node lists the whole fragment. Lists
     * are first collapsed into one {@code "* item, "} paragraph each. Blocks with empty text are dropped. The
     * given tree is not modified.
     */
    public List<TextBlock> extract(List<? extends ContentNode> nodes) {
        List<ContentNode> roots = ContentTreeUtils.deepCopy(nodes);
        collapseLists(roots);

        ContentElement fragment = new ContentElement(FRAGMENT_TAG, null, roots);
        List<ContentElement> candidates = new ArrayList<>();
        collectBlockCandidates(roots, fragment, candidates);

        List<TextBlock> blocks = new ArrayList<>(candidates.size());
        for (ContentElement candidate : candidates) {
            TextBlock block = toBlock(candidate);
            if (block.getText() != null) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    private void collapseLists(List<ContentNode> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            ContentNode node = nodes.get(i);
            if (!(node instanceof ContentElement element)) {
                continue;
            }
            if (LIST_TAGS.contains(element.tagName())) {
                nodes.set(i, collapseList(element));
            } else {
                List<ContentNode> children = new ArrayList<>(element.children());
                collapseLists(children);
                element.replaceChildren(children);
            }
        }
    }

    private ContentElement collapseList(ContentElement list) {
        List<ContentElement> items = new ArrayList<>();
        collectListItems(list, items);
        StringBuilder plainItems = new StringBuilder();
        for (ContentElement item : items) {
            String itemText = leafText(item);
            if (itemText != null) {
                plainItems.append(itemText);
            }
        }
        ContentElement paragraph = new ContentElement(PARAGRAPH_TAG, list.attributes(), List.of());
        paragraph.appendChild(ContentText.plain(plainItems.toString()));
        return paragraph;
    }

    private void collectListItems(ContentElement element, List<ContentElement> items) {
        for (ContentNode child : element.children()) {
            if (child instanceof ContentElement childElement) {
                if (LIST_ITEM_TAG.equals(childElement.tagName())) {
                    items.add(childElement);
                }
                collectListItems(childElement, items);
            }
        }
    }

    private void collectBlockCandidates(
        List<ContentNode> nodes,
        ContentElement parent,
        List<ContentElement> candidates
    ) {
        for (ContentNode node : nodes) {
            if (node instanceof ContentText) {
                candidates.add(parent);
            } else {
                ContentElement element = (ContentElement) node;
                collectBlockCandidates(element.children(), element, candidates);
            }
        }
    }

    private TextBlock toBlock(ContentElement candidate) {
        return TextBlock.builder()
            .nodeIndex(candidate.attr(NodeIndexer.NODE_INDEX_ATTR))
            .text(leafText(candidate))
            .build();
    }

    /**
     * @return normalized visible text, list items as {@code "* text, "}, null when empty
     */
    private String leafText(ContentElement element) {
        String plainText = textNormalizer.normalize(ContentTreeUtils.visibleText(element));
        if (plainText.isEmpty()) {
            return null;
        }
        if (LIST_ITEM_TAG.equals(element.tagName())) {
            return "* " + plainText + ", ";
        }
        return plainText;
    }

}
