package syndicator;

import java.time.Instant;
import java.util.Objects;

/**
 * Quote linkage of a source item.
 *
 * @param id           source id of the quoted item
 * @param selfQuote    {@code true} when the quoted item belongs to the same account
 * @param text         quoted text, may be {@code null}
 * @param createdAt    creation time of the quoted item, may be {@code null}
 * @param referenceUrl public link to the quoted item usable on any target, may be {@code null}
 */
public record QuoteRef(String id, boolean selfQuote, String text, Instant createdAt, String referenceUrl) {

    public QuoteRef {
        Objects.requireNonNull(id, "id");
    }
}
