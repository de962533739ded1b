package fun.fengwk.rp.core.service.model;

import fun.fengwk.rp.core.service.article.model.ReadableArticle;
import fun.fengwk.rp.core.service.plain.model.TextBlock;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Plain content tool response model.
 *
 * @author fengwk
 */
@Data
@Builder
public class PlainContentResponse {

    private int statusCode;

    /**
     * Simplified markup.
     */
    private String content;

    private List<TextBlock> blocks;

    private ReadableArticle article;

    private Long elapsedMs;
    private String error;

}
