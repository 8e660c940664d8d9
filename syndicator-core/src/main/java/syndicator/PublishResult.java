package syndicator;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a fully posted thread: the remote ids in thread order (first is the root) and
 * an optional public link.
 */
public record PublishResult(List<String> remoteIds, String url) {

    public PublishResult {
        remoteIds = List.copyOf(Objects.requireNonNull(remoteIds, "remoteIds"));
        if (remoteIds.isEmpty()) {
            throw new IllegalArgumentException("remoteIds cannot be empty");
        }
    }

    public static PublishResult of(String remoteId) {
        return new PublishResult(List.of(remoteId), null);
    }

    public String rootId() {
        return remoteIds.get(0);
    }
}
