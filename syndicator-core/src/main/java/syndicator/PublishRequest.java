package syndicator;

import java.util.List;
import java.util.Objects;

/**
 * Input of one {@link syndicator.spi.Publisher#publish} call.
 *
 * @param item            the source item being syndicated
 * @param segments        prepared thread text, one entry per post, already within the target's limit
 * @param replyToRemoteId remote id on the same target the thread must reply to, or {@code null}
 */
public record PublishRequest(SourceItem item, List<String> segments, String replyToRemoteId) {

    public PublishRequest {
        Objects.requireNonNull(item, "item");
        segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("segments cannot be empty");
        }
    }

    public boolean isReply() {
        return replyToRemoteId != null;
    }
}
