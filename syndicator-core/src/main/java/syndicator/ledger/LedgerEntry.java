package syndicator.ledger;

import java.time.Instant;

/**
 * Ledger row of a source item.
 *
 * @param sourceId   source item id
 * @param contentCid content token reported when the item was first seen
 * @param createdAt  creation time of the source item
 * @param seenAt     first time the poller observed the item
 * @param deletedAt  time the item was found deleted at the source, or {@code null}
 */
public record LedgerEntry(String sourceId, String contentCid, Instant createdAt, Instant seenAt, Instant deletedAt) {

  public boolean isDeleted() {
    return deletedAt != null;
  }
}
