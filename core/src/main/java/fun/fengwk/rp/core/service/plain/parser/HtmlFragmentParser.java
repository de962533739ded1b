package fun.fengwk.rp.core.service.plain.parser;

import fun.fengwk.rp.core.service.plain.model.ContentElement;
import fun.fengwk.rp.core.service.plain.model.ContentNode;
import fun.fengwk.rp.core.service.plain.model.ContentText;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses an html fragment into a content tree.
 *
 * @author fengwk
 */
@Component
public class HtmlFragmentParser {

    public List<ContentNode> parse(String html) {
        Document document = Jsoup.parseBodyFragment(html == null ? "" : html);
        return convertAll(document.body().childNodes());
    }

    /**
     * Converts already parsed jsoup nodes, leaving them untouched.
     */
    public List<ContentNode> convertAll(List<Node> nodes) {
        List<ContentNode> converted = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            ContentNode contentNode = convert(node);
            if (contentNode != null) {
                converted.add(contentNode);
            }
        }
        return converted;
    }

    private ContentNode convert(Node node) {
        // CDataNode extends TextNode, check it first
        if (node instanceof CDataNode cdata) {
            return ContentText.cdata(cdata.getWholeText());
        }
        if (node instanceof TextNode text) {
            return ContentText.plain(text.getWholeText());
        }
        if (node instanceof Comment comment) {
            return ContentText.comment(comment.getData());
        }
        if (node instanceof DataNode data) {
            return ContentText.plain(data.getWholeData());
        }
        if (node instanceof Element element) {
            ContentElement contentElement = new ContentElement(element.normalName());
            for (Attribute attribute : element.attributes()) {
                contentElement.attr(attribute.getKey(), attribute.getValue());
            }
            convertAll(element.childNodes()).forEach(contentElement::appendChild);
            return contentElement;
        }
        // doctype, xml declaration
        return null;
    }

}
