package de.upb.sse.scriptgen.util;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

public final class TextUtil {
    public static final String CRLF = "\r\n";
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\n");

    private TextUtil() {}

    /** Unicode-aware whitespace test, so no-break spaces count as indentation too. */
    public static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    public static boolean isBlank(String value) {
        return value == null || indexOfNonWhitespace(value) == value.length();
    }

    public static String trim(String value) {
        int start = indexOfNonWhitespace(value);
        int end = value.length();
        while (end > start && isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    public static String trimStart(String value) {
        return value.substring(indexOfNonWhitespace(value));
    }

    /** Splits on CRLF or bare LF, keeping empty lines (and a trailing empty line). */
    public static List<String> splitLines(String text) {
        return Arrays.asList(LINE_BREAK.split(text, -1));
    }

    private static int indexOfNonWhitespace(String value) {
        int i = 0;
        while (i < value.length() && isWhitespace(value.charAt(i))) {
            i++;
        }
        return i;
    }
}
