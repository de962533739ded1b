package fun.fengwk.rp.core.service.plain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable element node. Owns its attribute map and child list exclusively.
 *
 * @author fengwk
 */
public final class ContentElement implements ContentNode {

    private final String tagName;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<ContentNode> children = new ArrayList<>();

    public ContentElement(String tagName) {
        this.tagName = Objects.requireNonNull(tagName, "tagName").toLowerCase(Locale.ROOT);
    }

    public ContentElement(String tagName, Map<String, String> attributes, List<? extends ContentNode> children) {
        this(tagName);
        if (attributes != null) {
            this.attributes.putAll(attributes);
        }
        if (children != null) {
            children.forEach(this::appendChild);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ELEMENT;
    }

    public String tagName() {
        return tagName;
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public boolean hasAttr(String name) {
        return attributes.containsKey(name);
    }

    /**
     * @return the attribute value, or null when absent
     */
    public String attr(String name) {
        return attributes.get(name);
    }

    public ContentElement attr(String name, String value) {
        attributes.put(Objects.requireNonNull(name, "name"), value == null ? "" : value);
        return this;
    }

    public List<ContentNode> children() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public ContentElement appendChild(ContentNode child) {
        children.add(Objects.requireNonNull(child, "child"));
        return this;
    }

    public ContentElement replaceChildren(List<? extends ContentNode> newChildren) {
        List<ContentNode> copy = new ArrayList<>(newChildren);
        children.clear();
        copy.forEach(this::appendChild);
        return this;
    }

    public ContentElement clearChildren() {
        children.clear();
        return this;
    }

    @Override
    public String toString() {
        return "<" + tagName + " " + attributes + ">" + children;
    }

}
