package syndicator.dispatch;

/**
 * Guards a job key while it is queued for or running on a worker, so overlapping fetch cycles
 * never hand the same job to two workers.
 */
public interface InFlightTracker {
  boolean tryAcquire(String jobKey);

  void release(String jobKey);

  int size();
}
