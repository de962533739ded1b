package fun.fengwk.rp.core.mcp;

import fun.fengwk.rp.core.service.PlainMcpService;
import fun.fengwk.rp.core.service.model.PlainContentResponse;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
public class PlainContentMcpTest {

    @Mock
    private PlainMcpService plainMcpService;

    @Mock
    private McpFormatter mcpFormatter;

    private PlainContentMcp plainContentMcp;

    @BeforeEach
    void setUp() {
        plainContentMcp = new PlainContentMcp(plainMcpService, mcpFormatter);
    }

    @Test
    public void testPlainContent() {
        PlainContentResponse response = PlainContentResponse.builder()
            .statusCode(200)
            .content("<p>a</p>")
            .build();
        when(plainMcpService.plainContent("<p> a </p>", true, false)).thenReturn(response);
        when(mcpFormatter.format(McpTemplate.PLAIN_CONTENT, response)).thenReturn("<p>a</p>");

        String result = plainContentMcp.plainContent("<p> a </p>", true, false);
        log.info("plain_content result:\n{}", result);

        assertThat(result).isEqualTo("<p>a</p>");
        verify(plainMcpService).plainContent("<p> a </p>", true, false);
    }

    @Test
    public void testPlainTextBlocks() {
        PlainContentResponse response = PlainContentResponse.builder()
            .statusCode(400)
            .error("html is blank")
            .build();
        when(plainMcpService.textBlocks(" ", null)).thenReturn(response);
        when(mcpFormatter.format(McpTemplate.TEXT_BLOCKS, response)).thenReturn("Error: html is blank");

        String result = plainContentMcp.plainTextBlocks(" ", null);

        assertThat(result).isEqualTo("Error: html is blank");
        verify(mcpFormatter).format(McpTemplate.TEXT_BLOCKS, response);
    }

    @Test
    public void testSimplifyArticle() {
        PlainContentResponse response = PlainContentResponse.builder()
            .statusCode(200)
            .build();
        when(plainMcpService.simplifyArticle("{}", null, null)).thenReturn(response);
        when(mcpFormatter.format(McpTemplate.ARTICLE, response)).thenReturn("Title: -");

        String result = plainContentMcp.simplifyArticle("{}", null, null);

        assertThat(result).isEqualTo("Title: -");
        verify(plainMcpService).simplifyArticle("{}", null, null);
    }

}
