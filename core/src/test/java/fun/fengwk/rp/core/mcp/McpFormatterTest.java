package fun.fengwk.rp.core.mcp;

import fun.fengwk.rp.core.configuration.FreeMarkerConfiguration;
import fun.fengwk.rp.core.service.article.model.ReadableArticle;
import fun.fengwk.rp.core.service.model.PlainContentResponse;
import fun.fengwk.rp.core.service.plain.model.TextBlock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class McpFormatterTest {

    private final McpFormatter mcpFormatter = new McpFormatter(new FreeMarkerConfiguration().mcpTemplateConfiguration());

    @Test
    public void shouldRenderPlainContentVerbatim() {
        PlainContentResponse response = PlainContentResponse.builder()
            .statusCode(200)
            .content("<div><p>Tom &amp; Jerry</p></div>")
            .build();

        String result = mcpFormatter.format(McpTemplate.PLAIN_CONTENT, response);

        assertThat(result).isEqualTo("<div><p>Tom &amp; Jerry</p></div>");
    }

    @ParameterizedTest
    @EnumSource(McpTemplate.class)
    public void shouldReportErrorWithoutRendering(McpTemplate template) {
        PlainContentResponse response = PlainContentResponse.builder()
            .statusCode(400)
            .error("html is blank")
            .build();

        assertThat(mcpFormatter.format(template, response)).isEqualTo("Error: html is blank");
    }

    @Test
    public void shouldRenderNumberedBlocks() {
        PlainContentResponse response = PlainContentResponse.builder()
            .statusCode(200)
            .blocks(List.of(
                TextBlock.builder().nodeIndex("0.1").text("First").build(),
                TextBlock.builder().text("Second").build()
            ))
            .build();

        String result = mcpFormatter.format(McpTemplate.TEXT_BLOCKS, response);

        assertThat(result).isEqualTo("[1] (0.1) First\n[2] Second");
    }

    @Test
    public void shouldRenderNoBlocks() {
        PlainContentResponse response = PlainContentResponse.builder()
            .statusCode(200)
            .blocks(List.of())
            .build();

        assertThat(mcpFormatter.format(McpTemplate.TEXT_BLOCKS, response)).isEqualTo("No text blocks.");
    }

    @Test
    public void shouldRenderArticle() {
        ReadableArticle article = ReadableArticle.builder()
            .title("Deep Article")
            .siteName("Example")
            .length(12345)
            .textContent("<p>Body</p>")
            .build();
        PlainContentResponse response = PlainContentResponse.builder()
            .statusCode(200)
            .article(article)
            .build();

        String result = mcpFormatter.format(McpTemplate.ARTICLE, response);

        assertThat(result)
            .startsWith("Title: Deep Article")
            .contains("Byline: -")
            .contains("Site: Example")
            .contains("Length: 12345")
            .endsWith("<p>Body</p>");
    }

    @Test
    public void shouldReportTemplateFailure() {
        PlainContentResponse response = PlainContentResponse.builder().statusCode(200).build();

        assertThat(mcpFormatter.format(McpTemplate.ARTICLE, response)).startsWith("format error: ");
    }

    @Test
    public void shouldReportMissingTemplate() {
        assertThat(mcpFormatter.render("missing.ftl", Map.of())).startsWith("format error: ");
    }

    @Test
    public void shouldHandleNullResponse() {
        assertThat(mcpFormatter.format(McpTemplate.PLAIN_CONTENT, null)).isEqualTo("empty response");
    }

}
