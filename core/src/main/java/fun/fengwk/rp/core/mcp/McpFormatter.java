package fun.fengwk.rp.core.mcp;

import fun.fengwk.rp.core.service.model.PlainContentResponse;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Turns a {@link PlainContentResponse} into tool text. Failed responses are reported as {@code Error: <message>}
 * without touching a template; successful ones are rendered through the tool's template with the response
 * exposed as {@code data}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class McpFormatter {

    static final String EMPTY_RESPONSE = "empty response";
    static final String ERROR_PREFIX = "Error: ";
    static final String FORMAT_ERROR_PREFIX = "format error: ";

    private final freemarker.template.Configuration mcpTemplateConfiguration;

    public McpFormatter(@Qualifier("mcpTemplateConfiguration") freemarker.template.Configuration mcpTemplateConfiguration) {
        this.mcpTemplateConfiguration = mcpTemplateConfiguration;
    }

    public String format(McpTemplate template, PlainContentResponse response) {
        if (response == null) {
            return EMPTY_RESPONSE;
        }
        if (StringUtils.isNotBlank(response.getError())) {
            return ERROR_PREFIX + response.getError();
        }
        return render(template.getFileName(), Map.of("data", response));
    }

    String render(String templateName, Map<String, Object> root) {
        StringWriter result = new StringWriter(1024);
        try {
            Template template = mcpTemplateConfiguration.getTemplate(templateName);
            template.process(root, result);
            return result.toString().strip();
        } catch (IOException | TemplateException ex) {
            log.warn("render tool result failed, template={}, error={}", templateName, ex.getMessage());
            return FORMAT_ERROR_PREFIX + ex.getMessage();
        }
    }

}
