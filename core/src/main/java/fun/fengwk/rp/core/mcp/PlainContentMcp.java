package fun.fengwk.rp.core.mcp;

import fun.fengwk.rp.core.service.PlainMcpService;
import fun.fengwk.rp.core.service.model.PlainContentResponse;
import fun.fengwk.rp.core.utils.PlainTextResultConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class PlainContentMcp {

    private final PlainMcpService plainMcpService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "plain_content",
        description = """
            Simplify an article html fragment into its canonical plain form.
            Paragraphs and list items are reduced to normalized text, whitespace is collapsed, comments are emptied \
            and all other markup is kept.
            Optionally every element gets a data-content-digest (SHA-256 fingerprint of its text content) and a \
            data-node-index (dotted position such as 0.2.1).
            Return format: simplified html; or an error message.""",
        resultConverter = PlainTextResultConverter.class)
    public String plainContent(
        @ToolParam(description = "article html fragment") String html,
        @ToolParam(description = "attach content digests, default false", required = false) Boolean contentDigests,
        @ToolParam(description = "attach node indexes, default false", required = false) Boolean nodeIndexes
    ) {
        PlainContentResponse response = plainMcpService.plainContent(html, contentDigests, nodeIndexes);
        return mcpFormatter.format(McpTemplate.PLAIN_CONTENT, response);
    }

    @Tool(name = "plain_text_blocks",
        description = """
            Flatten an article html fragment into an ordered list of text blocks.
            By default each paragraph-like element becomes one normalized block, lists become one "* item, " block \
            and empty blocks are dropped; with raw=true every text node is listed unmodified.
            Return format: numbered block list with node index when present; or 'No text blocks.'; or an error message.""",
        resultConverter = PlainTextResultConverter.class)
    public String plainTextBlocks(
        @ToolParam(description = "article html fragment") String html,
        @ToolParam(description = "list raw text nodes instead of normalized blocks, default false", required = false) Boolean raw
    ) {
        PlainContentResponse response = plainMcpService.textBlocks(html, raw);
        return mcpFormatter.format(McpTemplate.TEXT_BLOCKS, response);
    }

    @Tool(name = "simplify_article",
        description = """
            Derive plain content for an article extracted by a Readability style extractor.
            Input is the extractor's json output with keys such as title, byline, content, excerpt, siteName and \
            publishedTime.
            Return format: article metadata followed by the plain content html; or an error message.""",
        resultConverter = PlainTextResultConverter.class)
    public String simplifyArticle(
        @ToolParam(description = "extractor json output") String articleJson,
        @ToolParam(description = "attach content digests, default false", required = false) Boolean contentDigests,
        @ToolParam(description = "attach node indexes, default false", required = false) Boolean nodeIndexes
    ) {
        PlainContentResponse response = plainMcpService.simplifyArticle(articleJson, contentDigests, nodeIndexes);
        return mcpFormatter.format(McpTemplate.ARTICLE, response);
    }

}
