package syndicator.spi;

import syndicator.model.Job;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI of the per-target job queues.
 *
 * <p>All methods receive an explicit {@link Connection}; the caller controls transaction
 * boundaries. Status transitions only apply to pending rows ({@code NEW} or {@code RETRY}) and
 * return the number of rows changed.
 */
public interface JobStore {

    /**
     * Inserts a job unless a row with the same key already exists, in any state.
     *
     * @return {@code true} if the job was inserted, {@code false} if the key was taken
     */
    boolean insertIfAbsent(Connection conn, Job job);

    int markDone(Connection conn, String jobKey);

    /**
     * Increments the attempt count and schedules the job again at {@code nextAt}.
     */
    int markRetry(Connection conn, String jobKey, Instant nextAt, String error);

    int markDead(Connection conn, String jobKey, String error);

    /**
     * Parks a job whose work moved to a derived job; {@code reason} is kept as last error.
     */
    int markDeferred(Connection conn, String jobKey, String reason);

    /**
     * Pending jobs of a target due at {@code now}, ordered by {@code notBefore} then enqueue order.
     */
    List<Job> pollDue(Connection conn, String target, Instant now, int limit);

    Optional<Job> find(Connection conn, String jobKey);

    /**
     * Number of pending jobs of a target, due or not.
     */
    int countPending(Connection conn, String target);

    /**
     * Deletes up to {@code limit} terminal jobs ({@code DONE}, {@code DEFERRED}, {@code DEAD})
     * last updated before {@code before}.
     *
     * @return rows deleted
     */
    int purgeTerminal(Connection conn, Instant before, int limit);
}
