package syndicator.segment;

/**
 * Measures text the way a target does when it enforces its post length limit.
 *
 * <p>Implementations must be pure and thread-safe.
 *
 * @see WeightedLengthCounter
 */
@FunctionalInterface
public interface LengthCounter {

    /** One unit per Unicode code point. */
    LengthCounter CODE_POINTS = text -> text.codePointCount(0, text.length());

    /** One unit per extended grapheme cluster. */
    LengthCounter GRAPHEMES = Graphemes::count;

    /**
     * Returns the length of {@code text} under this rule.
     *
     * @param text text to measure, never {@code null}
     * @return non-negative length
     */
    int count(String text);
}
