package fun.fengwk.rp.core.service.plain.parser;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Canonical text form: control, format, private-use and unassigned characters dropped (tab, line feed,
 * carriage return and form feed kept as whitespace), NFKC, whitespace runs collapsed to one space, trimmed.
 *
 * @author fengwk
 */
@Component
public class TextNormalizer {

    private static final Pattern INVISIBLE_CHAR = Pattern.compile("[\\p{C}&&[^\\t\\n\\r\\f]]");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = INVISIBLE_CHAR.matcher(text).replaceAll("");
        normalized = Normalizer.normalize(normalized, Normalizer.Form.NFKC);
        normalized = WHITESPACE_RUN.matcher(normalized).replaceAll(" ");
        return normalized.strip();
    }

}
