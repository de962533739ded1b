package fun.fengwk.rp.core.service;

import fun.fengwk.rp.core.service.model.PlainContentResponse;

/**
 * @author fengwk
 */
public interface PlainMcpService {

    PlainContentResponse plainContent(String html, Boolean contentDigests, Boolean nodeIndexes);

    PlainContentResponse textBlocks(String html, Boolean raw);

    PlainContentResponse simplifyArticle(String articleJson, Boolean contentDigests, Boolean nodeIndexes);

}
