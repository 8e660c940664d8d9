package syndicator.ledger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable record of what the pipeline has seen, published and deleted, plus the per-day
 * budget counters of capped targets.
 *
 * <p>Every mutation is a single-key upsert, atomic with respect to concurrent callers on the
 * same key. Missing data is reported through empty or {@code null} results, never through
 * exceptions; implementations throw only for infrastructure failures.
 */
public interface Ledger {

  boolean hasSeen(String sourceId);

  /**
   * Records that a source item has been observed. Repeated calls keep the first
   * {@code seenAt}; any earlier deletion marker is cleared.
   */
  void markSeen(String sourceId, String contentCid, Instant createdAt);

  /**
   * Marks a seen item as deleted at the source. No-op if the item was never seen or is
   * already marked deleted.
   */
  void markDeleted(String sourceId);

  boolean isDeleted(String sourceId);

  Optional<LedgerEntry> findEntry(String sourceId);

  /** Ids of all seen items not marked deleted. */
  Set<String> listActiveIds();

  /**
   * Records a fully posted thread, replacing any earlier record for the pair.
   *
   * @param remoteIds thread ids in order; must not be empty
   * @param remoteUrl public link of the thread root, may be {@code null}
   */
  void recordSuccess(String sourceId, String target, List<String> remoteIds, String remoteUrl);

  /**
   * Records a terminal failure. Remote ids and URL of an earlier success stay in place.
   */
  void recordFailure(String sourceId, String target, String error);

  /**
   * Records that the remote copy was deleted. Remote ids are kept for audit.
   */
  void recordDeletion(String sourceId, String target);

  Optional<PublishRecord> findRecord(String sourceId, String target);

  /** Remote ids of the pair in thread order; empty if nothing was recorded. */
  List<String> getRemoteIds(String sourceId, String target);

  /** First remote id of the pair, or {@code null}. */
  default String getRemoteId(String sourceId, String target) {
    List<String> ids = getRemoteIds(sourceId, target);
    return ids.isEmpty() ? null : ids.get(0);
  }

  /** Public link recorded for the pair, or {@code null}. */
  String getRemoteUrl(String sourceId, String target);

  /** Targets holding a successful record with at least one remote id for the item. */
  Set<String> getTargetsWithRemoteIds(String sourceId);

  /** Posts counted for the target on the given UTC day; {@code 0} when absent. */
  int getCount(String target, String dayKey);

  /**
   * Atomically adds {@code by} to the counter of the target and day.
   *
   * @return the counter value after the increment
   */
  int incrementCount(String target, String dayKey, int by);
}
