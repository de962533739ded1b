package fun.fengwk.rp.core.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class PlainTextResultConverterTest {

    private final PlainTextResultConverter converter = new PlainTextResultConverter();

    @Test
    public void shouldPassTextWithoutTrailingLineBreaks() {
        assertThat(converter.convert("<p>a</p>\n\n", String.class)).isEqualTo("<p>a</p>");
        assertThat(converter.convert(new StringBuilder("  x"), String.class)).isEqualTo("  x");
    }

    @Test
    public void shouldReturnEmptyForNull() {
        assertThat(converter.convert(null, String.class)).isEmpty();
    }

    @Test
    public void shouldRejectOtherTypes() {
        assertThatThrownBy(() -> converter.convert(42, Integer.class))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("unsupported result type");
    }

}
