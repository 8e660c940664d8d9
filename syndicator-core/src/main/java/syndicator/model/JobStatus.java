package syndicator.model;

public enum JobStatus {
  NEW(0),
  DONE(1),
  RETRY(2),
  DEAD(3),
  DEFERRED(4);

  private final int code;

  JobStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isPending() {
    return this == NEW || this == RETRY;
  }

  public static JobStatus fromCode(int code) {
    for (JobStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status code: " + code);
  }
}
