package syndicator.resolve;

import syndicator.QuoteRef;
import syndicator.SourceItem;
import syndicator.TargetProfile;
import syndicator.ledger.Ledger;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the text posted for an item that quotes another post.
 *
 * <p>A self-quote already syndicated to the target is inlined: the item text, a
 * {@code [Quoted yyyy-MM-dd HH:mm UTC]} header, the quoted text as {@code > } lines and the
 * link to the target's copy, separated by blank lines. Any other quote falls back to the
 * quote's reference link when there is one. Quoting never blocks posting.
 */
public final class QuoteComposer {
    private static final DateTimeFormatter QUOTED_AT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final Ledger ledger;

    public QuoteComposer(Ledger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public String compose(SourceItem item, TargetProfile target) {
        QuoteRef quote = item.quote();
        if (quote == null) {
            return item.text();
        }
        if (quote.selfQuote()) {
            String link = resolveLink(quote.id(), target);
            if (link != null) {
                return inline(item.text(), quote, link);
            }
        }
        if (quote.referenceUrl() == null || quote.referenceUrl().isBlank()) {
            return item.text();
        }
        return join(List.of(item.text().strip(), quote.referenceUrl()));
    }

    private String resolveLink(String quotedId, TargetProfile target) {
        if (ledger.isDeleted(quotedId)) {
            return null;
        }
        String url = ledger.getRemoteUrl(quotedId, target.name());
        if (url != null) {
            return url;
        }
        return target.remoteLink(ledger.getRemoteId(quotedId, target.name()));
    }

    private static String inline(String text, QuoteRef quote, String link) {
        List<String> parts = new ArrayList<>();
        parts.add(text.strip());
        parts.add(quote.createdAt() != null
                ? "[Quoted " + QUOTED_AT.format(quote.createdAt()) + " UTC]"
                : "[Quoted]");
        String quoted = quoteBlock(quote.text());
        if (!quoted.isEmpty()) {
            parts.add(quoted);
        }
        parts.add(link);
        return join(parts);
    }

    private static String quoteBlock(String text) {
        if (text == null) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.strip().split("\\R")) {
            if (!line.isBlank()) {
                lines.add("> " + line.strip());
            }
        }
        return String.join("\n", lines);
    }

    private static String join(List<String> parts) {
        List<String> nonEmpty = new ArrayList<>();
        for (String part : parts) {
            if (!part.isEmpty()) {
                nonEmpty.add(part);
            }
        }
        return String.join("\n\n", nonEmpty);
    }
}
