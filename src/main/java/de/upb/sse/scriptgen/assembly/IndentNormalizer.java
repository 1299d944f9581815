package de.upb.sse.scriptgen.assembly;

import de.upb.sse.scriptgen.configuration.ScriptGenConfiguration;
import de.upb.sse.scriptgen.util.TextUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the common leading indentation of a block of lines.
 * <p>
 * The indent to remove is the smallest non-zero visual width among the non-blank lines,
 * where a tab counts {@code tabWidth} columns and any other whitespace character one.
 * Stripping then walks raw characters, not columns: a line whose first non-whitespace
 * character comes before that many characters is trimmed completely, any other line loses
 * exactly that many characters. Lines indented with a different mix of tabs and spaces than
 * the narrowest one can therefore come out uneven. With a width of 4, {@code "\t    a();"} becomes
 * {@code " a();"}, while stripping by columns would give {@code "    a();"}. Column-based stripping,
 * as older generators did it, changes the output of such lines.
 */
public class IndentNormalizer {
    private final int tabWidth;

    public IndentNormalizer() {
        this(ScriptGenConfiguration.DEFAULT_TAB_WIDTH);
    }

    public IndentNormalizer(int tabWidth) {
        if (tabWidth < 1) throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
        this.tabWidth = tabWidth;
    }

    /** Normalizes the lines and joins them with CRLF. */
    public String normalize(List<String> lines) {
        return String.join(TextUtil.CRLF, deIndent(lines));
    }

    public List<String> deIndent(List<String> input) {
        List<String> lines = new ArrayList<>(input);
        int indent = Integer.MAX_VALUE;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (TextUtil.isBlank(line)) {
                lines.set(i, "");
                continue;
            }
            int width = visualIndentWidth(line);
            if (width > 0 && width < indent) {
                indent = width;
            }
        }
        if (indent == Integer.MAX_VALUE) {
            return lines;
        }

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isEmpty()) continue;
            lines.set(i, strip(line, indent));
        }
        return lines;
    }

    public int visualIndentWidth(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (!TextUtil.isWhitespace(c)) break;
            width += c == '\t' ? tabWidth : 1;
        }
        return width;
    }

    private String strip(String line, int indent) {
        // a non-blank line has fewer leading whitespace characters than its visual width, so j stays in range
        for (int j = 0; j < indent; j++) {
            if (!TextUtil.isWhitespace(line.charAt(j))) {
                return TextUtil.trimStart(line);
            }
        }
        return line.substring(indent);
    }
}
