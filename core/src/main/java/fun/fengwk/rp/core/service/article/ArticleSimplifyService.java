package fun.fengwk.rp.core.service.article;

import fun.fengwk.rp.core.service.article.model.ReadableArticle;
import fun.fengwk.rp.core.service.plain.model.PlainContentOptions;

/**
 * Derives plain content for extracted articles.
 *
 * @author fengwk
 */
public interface ArticleSimplifyService {

    /**
     * @return a copy of the article with text content and length filled from its html content
     */
    ReadableArticle simplify(ReadableArticle extracted, PlainContentOptions options);

    /**
     * @throws IllegalArgumentException when the json is blank or malformed
     */
    ReadableArticle simplify(String articleJson, PlainContentOptions options);

}
