package syndicator.segment;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weighted length rule used by microblogging targets that count most non-Latin text double.
 *
 * <p>A grapheme cluster whose first code point falls in one of the light ranges
 * (U+0000–U+10FF, U+2000–U+200D, U+2010–U+201F, U+2032–U+2037) weighs {@code 1}; every other
 * cluster weighs {@code 2}. Each {@code http://} or {@code https://} link counts as a fixed
 * {@link #DEFAULT_URL_WEIGHT} regardless of its actual length.
 */
public final class WeightedLengthCounter implements LengthCounter {
    public static final int DEFAULT_URL_WEIGHT = 23;

    private static final Pattern URL = Pattern.compile("https?://[^\\s]+", Pattern.CASE_INSENSITIVE);
    private static final int[][] LIGHT_RANGES = {
            {0x0000, 0x10FF},
            {0x2000, 0x200D},
            {0x2010, 0x201F},
            {0x2032, 0x2037},
    };

    private final int urlWeight;

    public WeightedLengthCounter() {
        this(DEFAULT_URL_WEIGHT);
    }

    public WeightedLengthCounter(int urlWeight) {
        if (urlWeight < 1) {
            throw new IllegalArgumentException("urlWeight must be >= 1");
        }
        this.urlWeight = urlWeight;
    }

    @Override
    public int count(String text) {
        int total = 0;
        int last = 0;
        Matcher matcher = URL.matcher(text);
        while (matcher.find()) {
            total += weighPlain(text.substring(last, matcher.start()));
            total += urlWeight;
            last = matcher.end();
        }
        return total + weighPlain(text.substring(last));
    }

    private static int weighPlain(String text) {
        int total = 0;
        for (String cluster : Graphemes.split(text)) {
            total += isLight(cluster.codePointAt(0)) ? 1 : 2;
        }
        return total;
    }

    private static boolean isLight(int codePoint) {
        for (int[] range : LIGHT_RANGES) {
            if (codePoint >= range[0] && codePoint <= range[1]) {
                return true;
            }
        }
        return false;
    }
}
