/**
 * Per-target job dispatch.
 *
 * <p>{@link syndicator.dispatch.Dispatcher} keeps one durable queue, fetch loop and worker pool
 * per target. Each attempt resolves reply dependencies, composes and segments the text, checks
 * the daily budget, waits for its pacing slot and calls the target's publisher. Outcomes are
 * explicit {@link syndicator.dispatch.DispatchOutcome} variants mapped onto job states; job
 * identity comes from {@link syndicator.dispatch.JobKeys}.
 *
 * @see syndicator.dispatch.Dispatcher
 * @see syndicator.dispatch.RetryPolicy
 * @see syndicator.dispatch.FailureClassifier
 */
package syndicator.dispatch;
