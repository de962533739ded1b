package fun.fengwk.rp.core.service.article.impl;

import fun.fengwk.rp.core.service.article.ArticleSimplifyService;
import fun.fengwk.rp.core.service.article.model.ReadableArticle;
import fun.fengwk.rp.core.service.plain.PlainContentService;
import fun.fengwk.rp.core.service.plain.model.PlainContentOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArticleSimplifyServiceImpl implements ArticleSimplifyService {

    private final PlainContentService plainContentService;

    @Override
    public ReadableArticle simplify(ReadableArticle extracted, PlainContentOptions options) {
        if (extracted == null) {
            throw new IllegalArgumentException("article is null");
        }
        String content = extracted.getContent();
        ReadableArticle simplified = extracted.toBuilder()
            .textContent(content == null ? null : plainContentService.plainContent(content, options))
            .length(StringUtils.isEmpty(content) ? null : content.codePointCount(0, content.length()))
            .build();
        log.debug("simplified article, title={}, length={}", simplified.getTitle(), simplified.getLength());
        return simplified;
    }

    @Override
    public ReadableArticle simplify(String articleJson, PlainContentOptions options) {
        return simplify(ReadableArticle.fromJson(articleJson), options);
    }

}
