/**
 * Length-bounded splitting of text into thread segments.
 *
 * <p>Lengths are measured by a pluggable {@link syndicator.segment.LengthCounter}: code points,
 * extended grapheme clusters, or a weighted count with fixed-cost URLs. Windows never split a
 * grapheme cluster.
 */
package syndicator.segment;
