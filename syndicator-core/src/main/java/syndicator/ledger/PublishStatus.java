package syndicator.ledger;

/**
 * Outcome recorded for one (source item, target) pair.
 */
public enum PublishStatus {
  SUCCESS(1),
  FAILED(2),
  DELETED(3);

  private final int code;

  PublishStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static PublishStatus fromCode(int code) {
    for (PublishStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown publish status code: " + code);
  }
}
