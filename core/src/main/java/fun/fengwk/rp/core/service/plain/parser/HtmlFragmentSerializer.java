package fun.fengwk.rp.core.service.plain.parser;

import fun.fengwk.rp.core.service.plain.model.ContentElement;
import fun.fengwk.rp.core.service.plain.model.ContentNode;
import fun.fengwk.rp.core.service.plain.model.ContentText;
import fun.fengwk.rp.core.service.plain.model.TextKind;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes a content tree back to html markup.
 *
 * @author fengwk
 */
@Component
public class HtmlFragmentSerializer {

    private static final Set<String> DATA_TAGS = Set.of("script", "style");

    public String serialize(List<? extends ContentNode> nodes) {
        Document document = new Document("");
        document.outputSettings().prettyPrint(false);
        for (ContentNode node : nodes) {
            document.appendChild(toJsoup(node, null));
        }
        return document.html();
    }

    public String serialize(ContentNode node) {
        return serialize(List.of(node));
    }

    private Node toJsoup(ContentNode node, String parentTag) {
        if (node instanceof ContentText text) {
            if (text.textKind() == TextKind.COMMENT) {
                return new Comment(text.text());
            }
            if (text.textKind() == TextKind.CDATA) {
                return new CDataNode(text.text());
            }
            if (parentTag != null && DATA_TAGS.contains(parentTag)) {
                return new DataNode(text.text());
            }
            return new TextNode(text.text());
        }
        ContentElement element = (ContentElement) node;
        Element jsoupElement = new Element(element.tagName());
        for (Map.Entry<String, String> attribute : element.attributes().entrySet()) {
            jsoupElement.attr(attribute.getKey(), attribute.getValue());
        }
        for (ContentNode child : element.children()) {
            jsoupElement.appendChild(toJsoup(child, element.tagName()));
        }
        return jsoupElement;
    }

}
