package fun.fengwk.rp.core.service.article.impl;

import fun.fengwk.rp.core.service.article.model.ReadableArticle;
import fun.fengwk.rp.core.service.plain.PlainContentService;
import fun.fengwk.rp.core.service.plain.model.PlainContentOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class ArticleSimplifyServiceImplTest {

    @Mock
    private PlainContentService plainContentService;

    private ArticleSimplifyServiceImpl articleSimplifyService;

    @BeforeEach
    void setUp() {
        articleSimplifyService = new ArticleSimplifyServiceImpl(plainContentService);
    }

    @Test
    public void shouldFillTextContentAndLength() {
        PlainContentOptions options = PlainContentOptions.builder().contentDigests(true).build();
        ReadableArticle extracted = ReadableArticle.builder()
            .title("Title")
            .siteName("Example")
            .content("<p> Body </p>")
            .build();
        when(plainContentService.plainContent("<p> Body </p>", options)).thenReturn("<p>Body</p>");

        ReadableArticle simplified = articleSimplifyService.simplify(extracted, options);

        assertThat(simplified).isNotSameAs(extracted);
        assertThat(simplified.getTitle()).isEqualTo("Title");
        assertThat(simplified.getSiteName()).isEqualTo("Example");
        assertThat(simplified.getContent()).isEqualTo("<p> Body </p>");
        assertThat(simplified.getTextContent()).isEqualTo("<p>Body</p>");
        assertThat(simplified.getLength()).isEqualTo(13);
        assertThat(extracted.getTextContent()).isNull();
        verify(plainContentService).plainContent("<p> Body </p>", options);
    }

    @Test
    public void shouldLeaveTextContentNullWithoutContent() {
        ReadableArticle simplified = articleSimplifyService.simplify(ReadableArticle.builder().title("T").build(), null);

        assertThat(simplified.getTextContent()).isNull();
        assertThat(simplified.getLength()).isNull();
        verifyNoInteractions(plainContentService);
    }

    @Test
    public void shouldLeaveLengthNullForEmptyContent() {
        when(plainContentService.plainContent("", null)).thenReturn("");

        ReadableArticle simplified = articleSimplifyService.simplify(ReadableArticle.builder().content("").build(), null);

        assertThat(simplified.getTextContent()).isEmpty();
        assertThat(simplified.getLength()).isNull();
    }

    @Test
    public void shouldCountLengthInCodePoints() {
        String content = "<p>\ud83d\ude00</p>";
        when(plainContentService.plainContent(content, null)).thenReturn(content);

        ReadableArticle simplified = articleSimplifyService.simplify(ReadableArticle.builder().content(content).build(), null);

        assertThat(content).hasSize(9);
        assertThat(simplified.getLength()).isEqualTo(8);
    }

    @Test
    public void shouldSimplifyFromJson() {
        when(plainContentService.plainContent("<p>x</p>", null)).thenReturn("<p>x</p>");

        ReadableArticle simplified = articleSimplifyService.simplify("{\"title\":\"T\",\"content\":\"<p>x</p>\"}", null);

        assertThat(simplified.getTitle()).isEqualTo("T");
        assertThat(simplified.getTextContent()).isEqualTo("<p>x</p>");
        assertThat(simplified.getLength()).isEqualTo(8);
    }

    @Test
    public void shouldRejectNullArticle() {
        assertThatThrownBy(() -> articleSimplifyService.simplify((ReadableArticle) null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("article is null");
    }

}
