package syndicator;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable unit observed on the source feed: one post of the originating account,
 * normalized into a fixed shape before it enters the pipeline.
 *
 * <p>An item is never modified after it has been observed; it can only be superseded by
 * a deletion. Use {@link #builder(String)} to create instances.
 *
 * @see syndicator.spi.SourceFeed
 */
public final class SourceItem {
    private final String id;
    private final String contentCid;
    private final Instant createdAt;
    private final String text;
    private final List<MediaAsset> media;
    private final List<String> links;
    private final ReplyRef reply;
    private final QuoteRef quote;

    private SourceItem(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        if (this.id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }
        this.contentCid = builder.contentCid;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
        this.text = builder.text == null ? "" : builder.text;
        this.media = builder.media == null ? List.of() : List.copyOf(builder.media);
        this.links = builder.links == null ? List.of() : List.copyOf(builder.links);
        this.reply = builder.reply;
        this.quote = builder.quote;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    /** Content hash or version token reported by the feed; may be {@code null}. */
    public String contentCid() {
        return contentCid;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String text() {
        return text;
    }

    public List<MediaAsset> media() {
        return media;
    }

    public List<String> links() {
        return links;
    }

    /** Reply linkage, or {@code null} when the item starts a new thread. */
    public ReplyRef reply() {
        return reply;
    }

    /** Quote linkage, or {@code null} when the item quotes nothing. */
    public QuoteRef quote() {
        return quote;
    }

    public boolean isReply() {
        return reply != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceItem other)) return false;
        return id.equals(other.id)
                && Objects.equals(contentCid, other.contentCid)
                && createdAt.equals(other.createdAt)
                && text.equals(other.text)
                && media.equals(other.media)
                && links.equals(other.links)
                && Objects.equals(reply, other.reply)
                && Objects.equals(quote, other.quote);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, contentCid, createdAt, text, media, links, reply, quote);
    }

    @Override
    public String toString() {
        return "SourceItem{id=" + id + ", createdAt=" + createdAt
                + ", media=" + media.size() + ", reply=" + (reply != null)
                + ", quote=" + (quote != null) + "}";
    }

    /** Builder for {@link SourceItem}. */
    public static final class Builder {
        private final String id;
        private String contentCid;
        private Instant createdAt;
        private String text;
        private List<MediaAsset> media;
        private List<String> links;
        private ReplyRef reply;
        private QuoteRef quote;

        private Builder(String id) {
            this.id = id;
        }

        public Builder contentCid(String contentCid) {
            this.contentCid = contentCid;
            return this;
        }

        /**
         * Sets the creation time of the item. <b>Required.</b>
         */
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder media(List<MediaAsset> media) {
            this.media = media;
            return this;
        }

        public Builder links(List<String> links) {
            this.links = links;
            return this;
        }

        public Builder reply(ReplyRef reply) {
            this.reply = reply;
            return this;
        }

        /**
         * Marks the item as a reply inside a thread rooted at {@code rootId}.
         */
        public Builder replyTo(String rootId, String parentId) {
            this.reply = new ReplyRef(rootId, parentId);
            return this;
        }

        public Builder quote(QuoteRef quote) {
            this.quote = quote;
            return this;
        }

        /**
         * @throws NullPointerException     if {@code id} or {@code createdAt} is null
         * @throws IllegalArgumentException if {@code id} is empty
         */
        public SourceItem build() {
            return new SourceItem(this);
        }
    }
}
