package work.leyline.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.leyline.shared.SourceText;

/**
 * Reads the {@code key = value} lines that configure tables and figures. Blank lines and
 * {@code #} comment lines are skipped. Keys are checked against a fixed set, each key may appear
 * once.
 */
final class MetadataReader {
    static final Pattern ENTRY = Pattern.compile("[ \\t]*([A-Za-z_][A-Za-z0-9_]*)[ \\t]*=[ \\t]*(.*?)[ \\t]*");

    /** A value with the position of its key. */
    record Entry(String key, String value, int line, int column) {}

    private final SourceText source;
    private final String owner;
    private final Set<String> keys;

    MetadataReader(SourceText source, String owner, Set<String> keys) {
        this.source = source;
        this.owner = owner;
        this.keys = keys;
    }

    /** Reads the lines in {@code [from, to)}, which must start at a line start. */
    Map<String, Entry> read(int from, int to) {
        Map<String, Entry> entries = new LinkedHashMap<>();
        int line = source.lineOf(from);
        int offset = from;
        while (offset < to) {
            int end = Math.min(source.lineEnd(line), to);
            String text = source.slice(offset, end);
            String stripped = text.strip();
            if (!stripped.isEmpty() && !stripped.startsWith("#")) {
                Matcher matcher = ENTRY.matcher(text);
                int column = text.length() - text.stripLeading().length() + 1;
                if (!matcher.matches()) {
                    throw new SyntaxException(source, line, column, "expected 'key = value' in " + owner + " options");
                }
                String key = matcher.group(1);
                if (!keys.contains(key)) {
                    throw new SyntaxException(source, line, column, "unknown " + owner + " option '" + key + "'");
                }
                if (entries.containsKey(key)) {
                    throw new SyntaxException(source, line, column, "duplicate " + owner + " option '" + key + "'");
                }
                entries.put(key, new Entry(key, unquote(matcher.group(2)), line, column));
            }
            line++;
            offset = source.lineStart(line);
            if (offset <= end) {
                break;
            }
        }
        return entries;
    }

    int integer(Entry entry) {
        if (!entry.value().matches("\\d+")) {
            throw error(entry, entry.key() + " must be a non-negative integer, got '" + entry.value() + "'");
        }
        try {
            return Integer.parseInt(entry.value());
        } catch (NumberFormatException e) {
            throw error(entry, entry.key() + " is out of range: " + entry.value());
        }
    }

    double positive(String raw, Entry entry) {
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw error(entry, entry.key() + " must be a positive number, got '" + raw + "'");
        }
        if (!(value > 0) || Double.isInfinite(value)) {
            throw error(entry, entry.key() + " must be a positive number, got '" + raw + "'");
        }
        return value;
    }

    SyntaxException error(Entry entry, String detail) {
        return new SyntaxException(source, entry.line(), entry.column(), detail);
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
