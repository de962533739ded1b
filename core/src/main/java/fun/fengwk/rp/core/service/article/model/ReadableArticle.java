package fun.fengwk.rp.core.service.article.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Article extracted by a Readability style extractor.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReadableArticle {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private String title;
    private String byline;
    private String dir;
    private String lang;

    /**
     * Article html as produced by the extractor.
     */
    private String content;

    /**
     * Plain content derived from {@link #content}.
     */
    private String textContent;

    /**
     * Character length of {@link #content}.
     */
    private Integer length;

    private String excerpt;
    private String siteName;
    private String publishedTime;

    /**
     * Reads the extractor's json output.
     *
     * @throws IllegalArgumentException when the json is blank or malformed
     */
    public static ReadableArticle fromJson(String json) {
        if (StringUtils.isBlank(json)) {
            throw new IllegalArgumentException("article json is blank");
        }
        try {
            ReadableArticle article = OBJECT_MAPPER.readValue(json, ReadableArticle.class);
            if (article == null) {
                throw new IllegalArgumentException("article json is null");
            }
            return article;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid article json: " + ex.getOriginalMessage(), ex);
        }
    }

}
