package syndicator.ledger;

import java.time.Instant;
import java.util.List;

/**
 * Ledger row of one (source item, target) pair. {@code remoteIds} lists the posted thread
 * in order, the first id being the thread root.
 */
public record PublishRecord(
    String sourceId,
    String target,
    PublishStatus status,
    List<String> remoteIds,
    String remoteUrl,
    String error,
    Instant updatedAt) {

  public PublishRecord {
    remoteIds = remoteIds == null ? List.of() : List.copyOf(remoteIds);
  }

  public String remoteId() {
    return remoteIds.isEmpty() ? null : remoteIds.get(0);
  }

  public boolean hasRemoteIds() {
    return status == PublishStatus.SUCCESS && !remoteIds.isEmpty();
  }
}
