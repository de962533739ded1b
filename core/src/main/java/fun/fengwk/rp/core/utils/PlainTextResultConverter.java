package fun.fengwk.rp.core.utils;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Passes rendered tool text through as is, without json quoting.
 *
 * @author fengwk
 */
public class PlainTextResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence text) {
            // templates end with a line break
            return text.toString().stripTrailing();
        }
        throw new IllegalStateException("unsupported result type: " + result.getClass());
    }

}
