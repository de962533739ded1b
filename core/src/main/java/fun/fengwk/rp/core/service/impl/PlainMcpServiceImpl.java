package fun.fengwk.rp.core.service.impl;

import fun.fengwk.rp.core.service.PlainMcpService;
import fun.fengwk.rp.core.service.article.ArticleSimplifyService;
import fun.fengwk.rp.core.service.article.model.ReadableArticle;
import fun.fengwk.rp.core.service.model.PlainContentResponse;
import fun.fengwk.rp.core.service.plain.PlainContentService;
import fun.fengwk.rp.core.service.plain.model.PlainContentOptions;
import fun.fengwk.rp.core.service.plain.model.TextBlock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlainMcpServiceImpl implements PlainMcpService {

    private final PlainContentService plainContentService;
    private final ArticleSimplifyService articleSimplifyService;

    @Override
    public PlainContentResponse plainContent(String html, Boolean contentDigests, Boolean nodeIndexes) {
        return execute("plain_content", () -> {
            validateHtml(html);
            String content = plainContentService.plainContent(html, buildOptions(contentDigests, nodeIndexes));
            return PlainContentResponse.builder()
                .statusCode(200)
                .content(content);
        });
    }

    @Override
    public PlainContentResponse textBlocks(String html, Boolean raw) {
        return execute("plain_text_blocks", () -> {
            validateHtml(html);
            List<TextBlock> blocks = Boolean.TRUE.equals(raw)
                ? plainContentService.rawTextBlocks(html)
                : plainContentService.textBlocks(html);
            return PlainContentResponse.builder()
                .statusCode(200)
                .blocks(blocks);
        });
    }

    @Override
    public PlainContentResponse simplifyArticle(String articleJson, Boolean contentDigests, Boolean nodeIndexes) {
        return execute("simplify_article", () -> {
            ReadableArticle article = articleSimplifyService.simplify(
                articleJson, buildOptions(contentDigests, nodeIndexes));
            return PlainContentResponse.builder()
                .statusCode(200)
                .article(article)
                .content(article.getTextContent());
        });
    }

    private PlainContentResponse execute(
        String operation,
        Supplier<PlainContentResponse.PlainContentResponseBuilder> action
    ) {
        long startAt = System.currentTimeMillis();
        try {
            return action.get()
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (IllegalArgumentException ex) {
            log.warn("{} request invalid, error={}", operation, ex.getMessage());
            return PlainContentResponse.builder()
                .statusCode(400)
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (Exception ex) {
            log.warn("{} failed, error={}", operation, ex.getMessage(), ex);
            return PlainContentResponse.builder()
                .statusCode(500)
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        }
    }

    private void validateHtml(String html) {
        if (StringUtils.isBlank(html)) {
            throw new IllegalArgumentException("html is blank");
        }
    }

    private PlainContentOptions buildOptions(Boolean contentDigests, Boolean nodeIndexes) {
        return PlainContentOptions.builder()
            .contentDigests(contentDigests)
            .nodeIndexes(nodeIndexes)
            .build();
    }

}
