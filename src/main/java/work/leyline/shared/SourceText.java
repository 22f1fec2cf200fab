package work.leyline.shared;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view over a document's source with line bookkeeping, used for positions,
 * caret excerpts and verbatim slicing.
 */
public final class SourceText {
    private final String filename;
    private final String text;
    private final int[] lineStarts;

    public SourceText(String filename, String text) {
        this.filename = filename == null || filename.isBlank() ? "<document>" : filename;
        this.text = Objects.requireNonNull(text, "text");
        this.lineStarts = computeLineStarts(text);
    }

    public String filename() {
        return filename;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public char charAt(int offset) {
        return text.charAt(offset);
    }

    public String slice(int from, int to) {
        return text.substring(from, to);
    }

    /** 1-based line containing {@code offset}. */
    public int lineOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    /** 1-based column of {@code offset} within its line. */
    public int columnOf(int offset) {
        return offset - lineStart(lineOf(offset)) + 1;
    }

    public int lineStart(int line) {
        return lineStarts[Math.max(0, Math.min(line, lineStarts.length) - 1)];
    }

    public int lineStartOf(int offset) {
        return lineStart(lineOf(offset));
    }

    public int lineEnd(int line) {
        int offset = lineStart(line);
        while (offset < text.length() && text.charAt(offset) != '\n' && text.charAt(offset) != '\r') {
            offset++;
        }
        return offset;
    }

    public String lineText(int line) {
        return text.substring(lineStart(line), lineEnd(line));
    }

    /**
     * Copy of the source line with a caret under {@code column}.
     */
    public String excerpt(int line, int column) {
        String lineText = lineText(line);
        StringBuilder caret = new StringBuilder(lineText.length() + 1);
        for (int i = 0; i < Math.max(0, column - 1); i++) {
            char ch = i < lineText.length() ? lineText.charAt(i) : ' ';
            caret.append(ch == '\t' ? '\t' : ' ');
        }
        caret.append('^');
        return lineText + "\n" + caret;
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\n') {
                starts.add(i + 1);
            } else if (ch == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
        }
        int[] result = new int[starts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = starts.get(i);
        }
        return result;
    }
}
