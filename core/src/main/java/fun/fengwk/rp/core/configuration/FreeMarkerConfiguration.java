package fun.fengwk.rp.core.configuration;

import freemarker.cache.ClassTemplateLoader;
import freemarker.core.PlainTextOutputFormat;
import freemarker.template.TemplateExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tool results are plain text carrying html verbatim, so nothing is escaped and a template error fails the render
 * instead of leaving partial output behind.
 *
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    public static final String TEMPLATE_PATH = "/mcp/templates/";

    @Bean(name = "mcpTemplateConfiguration")
    public freemarker.template.Configuration mcpTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_34);
        cfg.setTemplateLoader(new ClassTemplateLoader(FreeMarkerConfiguration.class, TEMPLATE_PATH));
        // bundled templates never change at runtime
        cfg.setTemplateUpdateDelayMilliseconds(Long.MAX_VALUE);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setOutputFormat(PlainTextOutputFormat.INSTANCE);
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        // keep numbers such as content length free of grouping separators
        cfg.setNumberFormat("computer");
        return cfg;
    }

}
