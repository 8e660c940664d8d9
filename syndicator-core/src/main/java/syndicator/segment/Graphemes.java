package syndicator.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extended grapheme cluster helpers backed by the {@code \X} regex construct.
 */
public final class Graphemes {
    private static final Pattern CLUSTER = Pattern.compile("\\X");

    private Graphemes() {
    }

    /** Splits {@code text} into its grapheme clusters, in order. */
    public static List<String> split(String text) {
        List<String> clusters = new ArrayList<>();
        Matcher matcher = CLUSTER.matcher(text);
        while (matcher.find()) {
            clusters.add(matcher.group());
        }
        return clusters;
    }

    public static int count(String text) {
        int count = 0;
        Matcher matcher = CLUSTER.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    static boolean isWhitespace(String cluster) {
        int cp = cluster.codePointAt(0);
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp);
    }
}
