package fun.fengwk.rp.core.service.plain.impl;

import fun.fengwk.rp.core.service.plain.PlainContentProperties;
import fun.fengwk.rp.core.service.plain.PlainContentService;
import fun.fengwk.rp.core.service.plain.PlainTreeRewriter;
import fun.fengwk.rp.core.service.plain.TextBlockExtractor;
import fun.fengwk.rp.core.service.plain.model.ContentNode;
import fun.fengwk.rp.core.service.plain.model.PlainContentOptions;
import fun.fengwk.rp.core.service.plain.model.TextBlock;
import fun.fengwk.rp.core.service.plain.parser.HtmlFragmentParser;
import fun.fengwk.rp.core.service.plain.parser.HtmlFragmentSerializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plain content service implementation.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlainContentServiceImpl implements PlainContentService {

    private final PlainContentProperties plainContentProperties;
    private final HtmlFragmentParser htmlFragmentParser;
    private final HtmlFragmentSerializer htmlFragmentSerializer;
    private final PlainTreeRewriter plainTreeRewriter;
    private final TextBlockExtractor textBlockExtractor;

    @Override
    public String plainContent(String html, PlainContentOptions options) {
        List<ContentNode> nodes = htmlFragmentParser.parse(html);
        return htmlFragmentSerializer.serialize(plainNodes(nodes, options));
    }

    @Override
    public List<ContentNode> plainNodes(List<ContentNode> nodes, PlainContentOptions options) {
        boolean contentDigests = resolveContentDigests(options);
        boolean nodeIndexes = resolveNodeIndexes(options);
        log.debug("rewrite plain content, roots={}, contentDigests={}, nodeIndexes={}",
            nodes.size(), contentDigests, nodeIndexes);
        return plainTreeRewriter.rewrite(nodes, contentDigests, nodeIndexes);
    }

    @Override
    public List<TextBlock> textBlocks(String html) {
        List<TextBlock> blocks = textBlockExtractor.extract(htmlFragmentParser.parse(html));
        log.debug("extracted plain text blocks, count={}", blocks.size());
        return blocks;
    }

    @Override
    public List<TextBlock> rawTextBlocks(String html) {
        List<TextBlock> blocks = textBlockExtractor.extractRaw(htmlFragmentParser.parse(html));
        log.debug("extracted raw text blocks, count={}", blocks.size());
        return blocks;
    }

    private boolean resolveContentDigests(PlainContentOptions options) {
        if (options == null || options.getContentDigests() == null) {
            return plainContentProperties.isContentDigests();
        }
        return options.getContentDigests();
    }

    private boolean resolveNodeIndexes(PlainContentOptions options) {
        if (options == null || options.getNodeIndexes() == null) {
            return plainContentProperties.isNodeIndexes();
        }
        return options.getNodeIndexes();
    }

}
