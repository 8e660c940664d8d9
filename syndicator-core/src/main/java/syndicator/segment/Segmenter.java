package syndicator.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits text into a thread of posts that each fit a target's length limit.
 *
 * <p>Text that already fits is returned as a single trimmed segment. Longer text is cut into
 * greedy windows of grapheme clusters, each bounded by {@code maxLength - reserveForCounter}.
 * A window prefers to end after the last whitespace or sentence punctuation
 * ({@code . ! ? , ; :}) when that keeps at least 55% of the greedy window; otherwise it breaks
 * hard at the last fitting cluster. When two or more windows result, every window gets a
 * {@code " i/N"} suffix and is re-trimmed so that window plus suffix fits {@code maxLength}.
 * A single window means the input is hard-trimmed to {@code maxLength} instead.
 *
 * <p>All methods are pure and thread-safe. No cluster is ever cut in the middle.
 */
public final class Segmenter {
    public static final int DEFAULT_RESERVE_FOR_COUNTER = 6;

    private static final double MIN_BOUNDARY_RATIO = 0.55;
    private static final String BREAK_PUNCTUATION = ".!?,;:";

    private Segmenter() {
    }

    public static List<String> segment(String text, int maxLength, LengthCounter counter) {
        return segment(text, maxLength, counter, DEFAULT_RESERVE_FOR_COUNTER);
    }

    /**
     * Splits {@code text} into segments of at most {@code maxLength} units of {@code counter}.
     *
     * @param text              text to split; {@code null} is treated as empty
     * @param maxLength         per-segment limit, at least 1
     * @param counter           the target's length rule
     * @param reserveForCounter room kept free in each window for the {@code " i/N"} suffix
     * @return the segments in thread order; {@code [""]} for blank input
     * @throws IllegalArgumentException if {@code maxLength} is too small to hold a
     *                                  {@code " i/N"} suffix and at least one cluster of text
     */
    public static List<String> segment(String text, int maxLength, LengthCounter counter, int reserveForCounter) {
        Objects.requireNonNull(counter, "counter");
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be >= 1");
        }
        String input = text == null ? "" : text.strip();
        if (input.isEmpty()) {
            return List.of("");
        }
        if (counter.count(input) <= maxLength) {
            return List.of(input);
        }

        List<String> windows = splitWindows(input, Math.max(1, maxLength - reserveForCounter), counter);
        if (windows.size() <= 1) {
            return List.of(trimToLimit(input, maxLength, counter));
        }

        int total = windows.size();
        List<String> segments = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            String suffix = " " + (i + 1) + "/" + total;
            String body = trimToLimit(windows.get(i), maxLength - counter.count(suffix), counter);
            if (body.isEmpty()) {
                throw new IllegalArgumentException("maxLength " + maxLength
                        + " leaves no room for text next to suffix '" + suffix + "'");
            }
            segments.add(body + suffix);
        }
        return List.copyOf(segments);
    }

    static List<String> splitWindows(String text, int budget, LengthCounter counter) {
        List<String> clusters = Graphemes.split(text);
        List<String> windows = new ArrayList<>();
        int cursor = 0;

        while (cursor < clusters.size()) {
            int end = cursor;
            int lastBoundary = -1;
            StringBuilder window = new StringBuilder();

            while (end < clusters.size()) {
                String cluster = clusters.get(end);
                window.append(cluster);
                if (counter.count(window.toString()) > budget) {
                    window.setLength(window.length() - cluster.length());
                    break;
                }
                if (isBreakCandidate(cluster)) {
                    lastBoundary = end;
                }
                end++;
            }

            boolean reachedEnd = end >= clusters.size();
            String candidate = window.toString();
            if (end == cursor) {
                // a single cluster wider than the budget becomes its own window
                candidate = clusters.get(cursor);
                end = cursor + 1;
            } else if (!reachedEnd && lastBoundary >= cursor && lastBoundary + 1 < end) {
                int fullWindow = end - cursor;
                int boundaryWindow = lastBoundary + 1 - cursor;
                if (boundaryWindow >= (int) Math.floor(fullWindow * MIN_BOUNDARY_RATIO)) {
                    end = lastBoundary + 1;
                    candidate = String.join("", clusters.subList(cursor, end));
                }
            }

            String cleaned = candidate.strip();
            if (!cleaned.isEmpty()) {
                windows.add(cleaned);
            }

            cursor = end;
            while (cursor < clusters.size() && Graphemes.isWhitespace(clusters.get(cursor))) {
                cursor++;
            }
        }
        return windows;
    }

    static String trimToLimit(String text, int maxLength, LengthCounter counter) {
        if (counter.count(text) <= maxLength) {
            return text;
        }
        StringBuilder out = new StringBuilder();
        for (String cluster : Graphemes.split(text)) {
            out.append(cluster);
            if (counter.count(out.toString()) > maxLength) {
                out.setLength(out.length() - cluster.length());
                break;
            }
        }
        return out.toString().stripTrailing();
    }

    private static boolean isBreakCandidate(String cluster) {
        return Graphemes.isWhitespace(cluster)
                || (cluster.length() == 1 && BREAK_PUNCTUATION.indexOf(cluster.charAt(0)) >= 0);
    }
}
