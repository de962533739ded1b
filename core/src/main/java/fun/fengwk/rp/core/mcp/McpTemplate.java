package fun.fengwk.rp.core.mcp;

/**
 * Result templates of the plain content tools, resolved under
 * {@link fun.fengwk.rp.core.configuration.FreeMarkerConfiguration#TEMPLATE_PATH}.
 *
 * @author fengwk
 */
public enum McpTemplate {

    PLAIN_CONTENT("rp_plain_content_result.ftl"),
    TEXT_BLOCKS("rp_text_blocks_result.ftl"),
    ARTICLE("rp_article_result.ftl");

    private final String fileName;

    McpTemplate(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

}
