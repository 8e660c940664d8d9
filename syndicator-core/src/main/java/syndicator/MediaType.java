package syndicator;

/** Kind of media attached to a {@link SourceItem}. */
public enum MediaType {
    IMAGE,
    VIDEO
}
