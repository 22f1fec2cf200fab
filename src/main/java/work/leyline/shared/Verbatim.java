package work.leyline.shared;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Clean-up applied to verbatim source slices handed to external evaluators.
 */
public final class Verbatim {
    private Verbatim() {}

    /**
     * Strips the common leading whitespace, one leading and one trailing blank line, and trailing
     * whitespace.
     */
    public static String clean(String raw) {
        List<String> lines = new ArrayList<>(Arrays.asList(dedent(normalizeNewlines(raw)).split("\n", -1)));
        if (lines.size() > 1 && lines.get(0).isBlank()) {
            lines.remove(0);
        }
        if (lines.size() > 1 && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines).stripTrailing();
    }

    /**
     * Removes the longest whitespace prefix shared by every non-blank line. Blank lines are emptied.
     */
    public static String dedent(String text) {
        String[] lines = text.split("\n", -1);
        String common = null;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            String prefix = leadingWhitespace(line);
            if (common == null) {
                common = prefix;
            } else {
                common = commonPrefix(common, prefix);
            }
        }
        if (common == null || common.isEmpty()) {
            StringBuilder emptied = new StringBuilder(text.length());
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    emptied.append('\n');
                }
                emptied.append(lines[i].isBlank() ? "" : lines[i]);
            }
            return emptied.toString();
        }
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                builder.append('\n');
            }
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            builder.append(line.substring(common.length()));
        }
        return builder.toString();
    }

    public static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    public static String normalizeNewlines(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static String commonPrefix(String left, String right) {
        int limit = Math.min(left.length(), right.length());
        int i = 0;
        while (i < limit && left.charAt(i) == right.charAt(i)) {
            i++;
        }
        return left.substring(0, i);
    }
}
