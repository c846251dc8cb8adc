package xorgconf.sections;

import org.apache.commons.lang3.StringUtils;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

final class EntryFormatter {

    static final String INDENT = "  ";
    static final String LINE_SEPARATOR = "\n";

    private static final String OPTION_KEYWORD = "Option";

    private EntryFormatter() {
    }

    /**
     * Appends the lines of a structured entry. Nothing is appended for an unset value.
     */
    static void appendEntry(StringBuilder out, String name, Object value) {
        if (isEmpty(value)) {
            return;
        }
        if (isSequence(value)) {
            for (Object element : asSequence(value)) {
                if (element != null) {
                    appendLine(out, name + " " + quote(stringify(element)));
                }
            }
            return;
        }
        appendLine(out, name + " " + quote(stringify(value)));
    }

    /**
     * Appends the {@code Option} lines of a single option.
     */
    static void appendOption(StringBuilder out, String name, Object value) {
        String prefix = OPTION_KEYWORD + " " + quote(name);
        if (isSequence(value)) {
            for (Object element : asSequence(value)) {
                if (element != null) {
                    appendLine(out, prefix + " " + quote(stringify(element)));
                }
            }
        } else if (value instanceof Boolean) {
            appendLine(out, prefix + " " + quote(stringify(value)));
        } else if (isIntegral(value)) {
            appendLine(out, prefix + " " + value);
        } else {
            String text = stringify(value);
            if (StringUtils.isEmpty(text)) {
                appendLine(out, prefix);
            } else {
                appendLine(out, prefix + " " + quote(text));
            }
        }
    }

    static void appendLine(StringBuilder out, String line) {
        out.append(INDENT).append(line).append(LINE_SEPARATOR);
    }

    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return StringUtils.isEmpty((CharSequence) value);
        }
        if (isSequence(value)) {
            return asSequence(value).isEmpty();
        }
        return false;
    }

    static String stringify(Object value) {
        if (value == null) {
            return StringUtils.EMPTY;
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    // Arrays, primitive ones included, render like lists.
    static boolean isSequence(Object value) {
        return value instanceof Collection || (value != null && value.getClass().isArray());
    }

    static Collection<?> asSequence(Object value) {
        if (value instanceof Collection) {
            return (Collection<?>) value;
        }
        int length = Array.getLength(value);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(value, i));
        }
        return elements;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger
                || value instanceof AtomicInteger || value instanceof AtomicLong;
    }

    private static String quote(String text) {
        return "\"" + text + "\"";
    }
}
