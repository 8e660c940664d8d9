package syndicator.resolve;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import syndicator.QuoteRef;
import syndicator.SourceItem;
import syndicator.TargetProfile;
import syndicator.testing.InMemoryLedger;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class QuoteComposerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant QUOTED_AT = Instant.parse("2024-04-30T08:15:30Z");

    private InMemoryLedger ledger;
    private QuoteComposer composer;
    private TargetProfile target;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger();
        composer = new QuoteComposer(ledger);
        target = TargetProfile.builder("x").remoteLinkFormat("https://x.example/status/%s").build();
    }

    @Test
    void itemWithoutQuoteKeepsItsText() {
        assertEquals("plain", composer.compose(item("plain", null), target));
    }

    @Test
    void syndicatedSelfQuoteIsInlined() {
        ledger.recordSuccess("q", "x", List.of("99"), null);
        QuoteRef quote = new QuoteRef("q", true, "line one\n\nline two", QUOTED_AT, null);

        String text = composer.compose(item("  my take  ", quote), target);

        assertEquals("my take\n\n[Quoted 2024-04-30 08:15 UTC]\n\n> line one\n> line two\n\n"
                + "https://x.example/status/99", text);
    }

    @Test
    void recordedRemoteUrlWinsOverLinkFormat() {
        ledger.recordSuccess("q", "x", List.of("99"), "https://x.example/custom/99");
        QuoteRef quote = new QuoteRef("q", true, "quoted", null, null);

        String text = composer.compose(item("take", quote), target);

        assertEquals("take\n\n[Quoted]\n\n> quoted\n\nhttps://x.example/custom/99", text);
    }

    @Test
    void unsyndicatedSelfQuoteFallsBackToReferenceUrl() {
        QuoteRef quote = new QuoteRef("q", true, "quoted", QUOTED_AT, "https://source.example/q");

        assertEquals("take\n\nhttps://source.example/q", composer.compose(item("take", quote), target));
    }

    @Test
    void foreignQuoteUsesReferenceUrl() {
        ledger.recordSuccess("q", "x", List.of("99"), null);
        QuoteRef quote = new QuoteRef("q", false, "theirs", QUOTED_AT, "https://source.example/q");

        assertEquals("take\n\nhttps://source.example/q", composer.compose(item("take", quote), target));
    }

    @Test
    void quoteWithoutAnyLinkLeavesTextAlone() {
        QuoteRef quote = new QuoteRef("q", false, "theirs", QUOTED_AT, null);

        assertEquals("take", composer.compose(item("take", quote), target));
    }

    @Test
    void deletedQuotedItemIsNotInlined() {
        ledger.markSeen("q", "cid", T0);
        ledger.recordSuccess("q", "x", List.of("99"), null);
        ledger.markDeleted("q");
        QuoteRef quote = new QuoteRef("q", true, "quoted", QUOTED_AT, null);

        assertEquals("take", composer.compose(item("take", quote), target));
    }

    private static SourceItem item(String text, QuoteRef quote) {
        return SourceItem.builder("a").createdAt(T0).text(text).quote(quote).build();
    }
}
