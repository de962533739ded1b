package fun.fengwk.rp.core.service.plain;

import fun.fengwk.rp.core.service.plain.model.ContentElement;
import fun.fengwk.rp.core.service.plain.model.ContentNode;
import fun.fengwk.rp.core.service.plain.model.ContentText;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Computes structural content digests and attaches them to elements.
 *
 * <p>The empty string is a sentinel meaning "nothing to hash". It is returned for blank text and for
 * elements without children. An element with a single child reuses the child's digest, so wrapper
 * elements do not change the digest of their content. An element with several children hashes the
 * concatenation of its children's non-empty digests, which yields the SHA-256 of zero bytes (not the
 * sentinel) when every child digest is empty.
 *
 * @author fengwk
 */
@Component
public class ContentDigester {

    public static final String CONTENT_DIGEST_ATTR = "data-content-digest";

    private static final HexFormat HEX = HexFormat.of();

    public ContentNode attach(ContentNode node) {
        return attach(node, null);
    }

    /**
     * Sets the digest attribute on elements; text nodes pass through unchanged.
     *
     * @param memo identity keyed digests of finished subtrees, may be null
     */
    public ContentNode attach(ContentNode node, Map<ContentNode, String> memo) {
        if (node instanceof ContentElement element) {
            element.attr(CONTENT_DIGEST_ATTR, digest(element, memo));
        }
        return node;
    }

    public String digest(ContentNode node) {
        return digest(node, null);
    }

    /**
     * @param memo identity keyed digests of finished subtrees, may be null
     */
    public String digest(ContentNode node, Map<ContentNode, String> memo) {
        if (memo == null) {
            return computeDigest(node, null);
        }
        String cached = memo.get(node);
        if (cached != null) {
            return cached;
        }
        String digest = computeDigest(node, memo);
        memo.put(node, digest);
        return digest;
    }

    private String computeDigest(ContentNode node, Map<ContentNode, String> memo) {
        if (node instanceof ContentText text) {
            String trimmed = text.text().strip();
            if (trimmed.isEmpty()) {
                return "";
            }
            return HEX.formatHex(newSha256().digest(trimmed.getBytes(StandardCharsets.UTF_8)));
        }

        List<ContentNode> children = ((ContentElement) node).children();
        if (children.isEmpty()) {
            return "";
        }
        if (children.size() == 1) {
            return digest(children.get(0), memo);
        }
        MessageDigest sha256 = newSha256();
        for (ContentNode child : children) {
            String childDigest = digest(child, memo);
            if (!childDigest.isEmpty()) {
                sha256.update(childDigest.getBytes(StandardCharsets.UTF_8));
            }
        }
        return HEX.formatHex(sha256.digest());
    }

    private MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

}
