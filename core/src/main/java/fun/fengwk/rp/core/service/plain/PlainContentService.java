package fun.fengwk.rp.core.service.plain;

import fun.fengwk.rp.core.service.plain.model.ContentNode;
import fun.fengwk.rp.core.service.plain.model.PlainContentOptions;
import fun.fengwk.rp.core.service.plain.model.TextBlock;

import java.util.List;

/**
 * Plain content entry.
 *
 * @author fengwk
 */
public interface PlainContentService {

    /**
     * Parses the html fragment, rewrites it to plain form and serializes it back to markup.
     *
     * @param options null means configured defaults
     */
    String plainContent(String html, PlainContentOptions options);

    /**
     * Rewrites an already parsed tree in place and returns the new top-level sequence.
     *
     * @param options null means configured defaults
     */
    List<ContentNode> plainNodes(List<ContentNode> nodes, PlainContentOptions options);

    List<TextBlock> textBlocks(String html);

    List<TextBlock> rawTextBlocks(String html);

}
