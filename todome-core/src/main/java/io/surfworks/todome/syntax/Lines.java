package io.surfworks.todome.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits document text into lines.
 *
 * <p>Lines end at {@code \n}; a trailing {@code \r} is dropped. A final newline
 * does not open another line, so {@code "a\nb\n"} and {@code "a\nb"} both have
 * two lines and the empty string has none.
 */
public final class Lines {

    private Lines() {}

    public static List<String> split(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int len = text.length();
        while (start < len) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? len : nl;
            int contentEnd = end > start && text.charAt(end - 1) == '\r' ? end - 1 : end;
            lines.add(text.substring(start, contentEnd));
            if (nl < 0) {
                break;
            }
            start = nl + 1;
        }
        return lines;
    }

    public static List<ClassifiedLine> classifyAll(List<String> lines) {
        List<ClassifiedLine> classified = new ArrayList<>(lines.size());
        for (String line : lines) {
            classified.add(LineClassifier.classify(line));
        }
        return classified;
    }
}
