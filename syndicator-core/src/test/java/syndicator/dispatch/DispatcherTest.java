package syndicator.dispatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import syndicator.PublishException;
import syndicator.PublishRequest;
import syndicator.RateLimitHints;
import syndicator.SourceItem;
import syndicator.TargetProfile;
import syndicator.ledger.PublishRecord;
import syndicator.ledger.PublishStatus;
import syndicator.model.Job;
import syndicator.model.JobStatus;
import syndicator.segment.LengthCounter;
import syndicator.testing.CountingMetrics;
import syndicator.testing.InMemoryJobStore;
import syndicator.testing.InMemoryLedger;
import syndicator.testing.MutableClock;
import syndicator.testing.RecordingPublisher;
import syndicator.testing.StubConnections;
import syndicator.util.UtcDays;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatcherTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryLedger ledger;
    private InMemoryJobStore store;
    private CountingMetrics metrics;
    private RecordingPublisher x;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        ledger = new InMemoryLedger(clock);
        store = new InMemoryJobStore(clock);
        metrics = new CountingMetrics();
        x = new RecordingPublisher("x");
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingCollaborators() {
        assertThrows(NullPointerException.class, () -> Dispatcher.builder()
                .jobStore(store).ledger(ledger).target(profile("x"), x).build());
        assertThrows(NullPointerException.class, () -> Dispatcher.builder()
                .connectionProvider(StubConnections.provider()).ledger(ledger).target(profile("x"), x).build());
        assertThrows(NullPointerException.class, () -> Dispatcher.builder()
                .connectionProvider(StubConnections.provider()).jobStore(store).target(profile("x"), x).build());
    }

    @Test
    void builderRequiresATarget() {
        assertThrows(IllegalArgumentException.class, () -> Dispatcher.builder()
                .connectionProvider(StubConnections.provider()).jobStore(store).ledger(ledger).build());
    }

    @Test
    void builderRejectsMismatchedPublisherName() {
        assertThrows(IllegalArgumentException.class,
                () -> Dispatcher.builder().target(profile("x"), new RecordingPublisher("bsky")));
    }

    @Test
    void builderRejectsDuplicateTarget() {
        assertThrows(IllegalArgumentException.class, () -> Dispatcher.builder()
                .target(profile("x"), x)
                .target(profile("x"), new RecordingPublisher("x")));
    }

    @Test
    void builderRejectsMaxAttemptsLessThanOne() {
        assertThrows(IllegalArgumentException.class, () -> builder().maxAttempts(0).build());
    }

    // ── Enqueue ─────────────────────────────────────────────────────

    @Test
    void enqueueCreatesOneJobPerTarget() {
        RecordingPublisher bsky = new RecordingPublisher("bsky");
        try (Dispatcher d = builder().target(profile("bsky"), bsky).build()) {
            assertEquals(2, d.enqueuePublish(item("a", "hello")));

            assertEquals(JobStatus.NEW, store.get(JobKeys.publish("x", "a")).status());
            assertEquals(JobStatus.NEW, store.get(JobKeys.publish("bsky", "a")).status());
            assertEquals(1, metrics.count("enqueued", "x"));
        }
    }

    @Test
    void reEnqueueCollapsesOntoExistingKey() {
        try (Dispatcher d = builder().build()) {
            assertEquals(1, d.enqueuePublish(item("a", "hello")));
            assertEquals(0, d.enqueuePublish(item("a", "hello")));

            assertEquals(1, store.all().size());
        }
    }

    @Test
    void enqueueFailsWhenDatabaseIsDown() {
        AtomicBoolean down = new AtomicBoolean(true);
        try (Dispatcher d = builder().connectionProvider(StubConnections.failing(down)).build()) {
            assertThrows(EnqueueException.class, () -> d.enqueuePublish(item("a", "hello")));
        }
    }

    @Test
    void enqueueAfterCloseThrows() {
        Dispatcher d = builder().build();
        d.close();

        assertThrows(IllegalStateException.class, () -> d.enqueuePublish(item("a", "hello")));
    }

    @Test
    void enqueueToUnknownTargetThrows() {
        try (Dispatcher d = builder().build()) {
            assertThrows(IllegalArgumentException.class, () -> d.enqueuePublish(item("a", "hi"), List.of("nope")));
        }
    }

    // ── Publish ─────────────────────────────────────────────────────

    @Test
    void publishRecordsRemoteIdsAndCompletesJob() {
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(item("a", "hello"));

            assertEquals(1, d.dispatchDue());

            assertEquals(JobStatus.DONE, store.get(JobKeys.publish("x", "a")).status());
            assertEquals(List.of("x-1"), ledger.getRemoteIds("a", "x"));
            assertEquals("https://x.example/x-1", ledger.getRemoteUrl("a", "x"));
            assertEquals(List.of("hello"), x.published.get(0).segments());
            assertEquals(1, metrics.count("success", "x"));
        }
    }

    @Test
    void longTextIsPublishedAsThread() {
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(item("a", "one two three four five six seven eight nine ten"));
            d.dispatchDue();

            assertEquals(List.of("one two three 1/4", "four five six 2/4", "seven eight 3/4", "nine ten 4/4"),
                    x.published.get(0).segments());
            assertEquals(List.of("x-1", "x-2", "x-3", "x-4"), ledger.getRemoteIds("a", "x"));
        }
    }

    @Test
    void alreadyPublishedItemIsNotPostedAgain() {
        ledger.recordSuccess("a", "x", List.of("x-77"), null);
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(item("a", "hello"));

            d.dispatchDue();

            assertTrue(x.published.isEmpty());
            assertEquals(JobStatus.DONE, store.get(JobKeys.publish("x", "a")).status());
            assertEquals(List.of("x-77"), ledger.getRemoteIds("a", "x"));
        }
    }

    @Test
    void deletedSourceItemIsSkipped() {
        ledger.markSeen("a", "cid", T0);
        ledger.markDeleted("a");
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(item("a", "hello"));

            d.dispatchDue();

            assertTrue(x.published.isEmpty());
            assertEquals(JobStatus.DONE, store.get(JobKeys.publish("x", "a")).status());
            assertTrue(ledger.findRecord("a", "x").isEmpty());
        }
    }

    // ── Reply dependencies ──────────────────────────────────────────

    @Test
    void replyWaitsForParentWithoutRecordingFailure() {
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(reply("c", "root", "parent"));
            Job job = store.get(JobKeys.publish("x", "c"));

            DispatchOutcome outcome = d.dispatch(job);

            assertInstanceOf(DispatchOutcome.DependencyNotReady.class, outcome);
            Job after = store.get(job.jobKey());
            assertEquals(JobStatus.RETRY, after.status());
            assertEquals(1, after.attempts());
            assertEquals(T0.plusMillis(10_000), after.notBefore());
            assertTrue(ledger.findRecord("c", "x").isEmpty());
            assertTrue(x.published.isEmpty());
        }
    }

    @Test
    void replyAttachesToParentOnceItIsPublished() {
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(reply("c", "root", "parent"));
            d.dispatchDue();

            ledger.recordSuccess("parent", "x", List.of("x-parent"), null);
            clock.advance(Duration.ofSeconds(10));
            d.dispatchDue();

            PublishRequest request = x.published.get(0);
            assertEquals("x-parent", request.replyToRemoteId());
            assertEquals(JobStatus.DONE, store.get(JobKeys.publish("x", "c")).status());
        }
    }

    @Test
    void replyStillUnresolvedAtAttemptCapIsRecordedFailed() {
        try (Dispatcher d = builder().maxAttempts(2).build()) {
            d.enqueuePublish(reply("c", "root", "parent"));
            d.dispatchDue();
            clock.advance(Duration.ofSeconds(10));
            d.dispatchDue();

            assertEquals(JobStatus.DEAD, store.get(JobKeys.publish("x", "c")).status());
            assertEquals(PublishStatus.FAILED, ledger.findRecord("c", "x").get().status());
        }
    }

    // ── Daily budget ────────────────────────────────────────────────

    @Test
    void exhaustedBudgetDefersToNextUtcMidnight() {
        TargetProfile capped = cappedProfile("x", 17);
        ledger.incrementCount("x", "2024-05-01", 17);
        try (Dispatcher d = builder(capped).build()) {
            d.enqueuePublish(item("a", "hello"));
            Job job = store.get(JobKeys.publish("x", "a"));

            DispatchOutcome outcome = d.dispatch(job);

            DispatchOutcome.BudgetExceeded budget = assertInstanceOf(DispatchOutcome.BudgetExceeded.class, outcome);
            assertEquals(17, budget.used());
            assertEquals(JobStatus.DEFERRED, store.get(job.jobKey()).status());
            Job derived = store.get(job.jobKey() + "-defer-2024-05-01");
            assertEquals(JobStatus.NEW, derived.status());
            assertEquals(Instant.parse("2024-05-02T00:00:00Z"), derived.notBefore());
            assertTrue(ledger.findRecord("a", "x").isEmpty());
            assertEquals(17, ledger.getCount("x", "2024-05-01"));
            assertTrue(x.published.isEmpty());
            assertEquals(1, metrics.count("deferred", "x"));
        }
    }

    @Test
    void deferredJobRunsOnNextDay() {
        TargetProfile capped = cappedProfile("x", 17);
        ledger.incrementCount("x", "2024-05-01", 17);
        try (Dispatcher d = builder(capped).build()) {
            d.enqueuePublish(item("a", "hello"));
            d.dispatchDue();

            clock.set(Instant.parse("2024-05-02T00:00:01Z"));
            assertEquals(1, d.dispatchDue());

            assertEquals(List.of("x-1"), ledger.getRemoteIds("a", "x"));
            assertEquals(1, ledger.getCount("x", "2024-05-02"));
            assertEquals(17, ledger.getCount("x", "2024-05-01"));
        }
    }

    @Test
    void publishedThreadIsCountedAgainstBudget() {
        try (Dispatcher d = builder(cappedProfile("x", 10)).build()) {
            d.enqueuePublish(item("a", "one two three four five six seven eight nine ten"));

            d.dispatchDue();

            assertEquals(4, ledger.getCount("x", "2024-05-01"));
        }
    }

    @Test
    void threadLongerThanDailyLimitIsRejected() {
        try (Dispatcher d = builder(cappedProfile("x", 2)).build()) {
            d.enqueuePublish(item("a", "one two three four five six seven eight nine ten"));

            d.dispatchDue();

            assertEquals(JobStatus.DEAD, store.get(JobKeys.publish("x", "a")).status());
            assertEquals(PublishStatus.FAILED, ledger.findRecord("a", "x").get().status());
            assertTrue(x.published.isEmpty());
        }
    }

    @Test
    void budgetDeferralsOnTheSameDayShareOneJob() {
        ledger.incrementCount("x", "2024-05-01", 17);
        try (Dispatcher d = builder(cappedProfile("x", 17)).build()) {
            d.enqueuePublish(item("a", "hello"));
            Job original = store.get(JobKeys.publish("x", "a"));
            Job resumed = original.deferredCopy(JobKeys.rateLimitDeferral(original.jobKey(), T0), T0, T0);
            store.insertIfAbsent(null, resumed);

            d.dispatch(original);
            d.dispatch(resumed);

            assertEquals(JobStatus.DEFERRED, store.get(original.jobKey()).status());
            assertEquals(JobStatus.DEFERRED, store.get(resumed.jobKey()).status());
            assertEquals(1, store.all().stream().filter(j -> j.jobKey().contains("-defer-")).count());
            assertEquals(JobStatus.NEW, store.get(JobKeys.budgetDeferral(original.jobKey(), "2024-05-01")).status());
            assertEquals(2, metrics.count("deferred", "x"));
        }
    }

    @Test
    void cappedTargetKeepsBudgetAndPacingWithConcurrentWorkers() throws InterruptedException {
        TargetProfile capped = TargetProfile.builder("x")
                .maxLength(20)
                .lengthCounter(LengthCounter.CODE_POINTS)
                .dailyLimit(2)
                .minInterval(Duration.ofMillis(100))
                .concurrency(4)
                .build();
        try (Dispatcher d = builder(capped).clock(Clock.systemUTC()).fetchIntervalMs(20).build()) {
            for (String id : List.of("a", "b", "c", "d")) {
                d.enqueuePublish(item(id, "post " + id));
            }
            d.start();

            long deadline = System.currentTimeMillis() + 5000;
            while (metrics.count("success", "x") + metrics.count("deferred", "x") < 4
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            assertEquals(2, x.published.size());
            assertEquals(2, metrics.count("success", "x"));
            assertEquals(2, metrics.count("deferred", "x"));
            assertEquals(2, ledger.getCount("x", UtcDays.dayKey(Instant.now())));
            long gap = x.publishNanos.get(1) - x.publishNanos.get(0);
            assertTrue(gap >= Duration.ofMillis(90).toNanos(), "posts " + gap + "ns apart");
        }
    }

    @Test
    void failedCounterIncrementDoesNotUndoPublish() {
        ledger.failIncrements.set(true);
        try (Dispatcher d = builder(cappedProfile("x", 10)).build()) {
            d.enqueuePublish(item("a", "hello"));

            d.dispatchDue();

            assertEquals(JobStatus.DONE, store.get(JobKeys.publish("x", "a")).status());
            assertEquals(List.of("x-1"), ledger.getRemoteIds("a", "x"));
        }
    }

    // ── Rate limits and failures ────────────────────────────────────

    @Test
    void rateLimitDefersUntilReset() {
        x.failNextPublish(PublishException.rateLimited("slow down", RateLimitHints.at(T0.plusSeconds(120))));
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(item("a", "hello"));
            String key = JobKeys.publish("x", "a");

            d.dispatchDue();

            assertEquals(JobStatus.DEFERRED, store.get(key).status());
            Job derived = store.get(key + "-rl-" + T0.plusSeconds(120).getEpochSecond());
            assertEquals(T0.plusSeconds(120), derived.notBefore());
            assertEquals(0, derived.attempts());
            assertTrue(ledger.findRecord("a", "x").isEmpty());

            clock.advance(Duration.ofSeconds(120));
            d.dispatchDue();
            assertEquals(JobStatus.DONE, store.get(derived.jobKey()).status());
            assertEquals(List.of("x-1"), ledger.getRemoteIds("a", "x"));
        }
    }

    @Test
    void rateLimitWithoutHintWaitsForFloor() {
        x.failNextPublish(new PublishException("slow down", 429));
        try (Dispatcher d = builder().rateLimitFloor(Duration.ofSeconds(45)).build()) {
            d.enqueuePublish(item("a", "hello"));

            d.dispatchDue();

            List<Job> pending = store.withStatus(JobStatus.NEW);
            assertEquals(1, pending.size());
            assertEquals(T0.plusSeconds(45), pending.get(0).notBefore());
        }
    }

    @Test
    void rateLimitsWithTheSameResetShareOneJob() {
        Instant reset = T0.plusSeconds(120);
        x.failNextPublish(PublishException.rateLimited("slow down", RateLimitHints.at(reset)))
                .failNextPublish(PublishException.rateLimited("slow down", RateLimitHints.at(reset)));
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(item("a", "hello"));
            Job original = store.get(JobKeys.publish("x", "a"));
            Job nextDay = original.deferredCopy(JobKeys.budgetDeferral(original.jobKey(), "2024-04-30"), T0, T0);
            store.insertIfAbsent(null, nextDay);

            d.dispatch(original);
            d.dispatch(nextDay);

            String derivedKey = JobKeys.rateLimitDeferral(original.jobKey(), reset);
            assertEquals(1, store.all().stream().filter(j -> j.jobKey().contains("-rl-")).count());
            assertEquals(reset, store.get(derivedKey).notBefore());

            clock.advance(Duration.ofSeconds(120));
            assertEquals(1, d.dispatchDue());
            assertEquals(1, x.published.size());
            assertEquals(List.of("x-1"), ledger.getRemoteIds("a", "x"));
        }
    }

    @Test
    void jobFinishedAfterPollIsNotAttemptedAgain() {
        SnapshotJobStore snapshots = new SnapshotJobStore(clock);
        store = snapshots;
        x.failNextPublish(new PublishException("bad gateway", 502));
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(item("a", "hello"));
            d.enqueuePublish(item("b", "world"));
            snapshots.freeze("x", T0);

            assertEquals(2, d.dispatchDue());
            assertEquals(0, d.dispatchDue());

            Job a = store.get(JobKeys.publish("x", "a"));
            assertEquals(JobStatus.RETRY, a.status());
            assertEquals(1, a.attempts());
            assertEquals(T0.plusSeconds(10), a.notBefore());
            assertEquals(JobStatus.DONE, store.get(JobKeys.publish("x", "b")).status());
            assertEquals(1, x.published.size());
            assertEquals(1, metrics.count("retry", "x"));
            assertEquals(1, metrics.count("success", "x"));
        }
    }

    @Test
    void permanentRejectionIsRecordedAndDead() {
        x.failNextPublish(new PublishException("duplicate content", 403));
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(item("a", "hello"));

            d.dispatchDue();

            Job job = store.get(JobKeys.publish("x", "a"));
            assertEquals(JobStatus.DEAD, job.status());
            assertEquals(0, job.attempts());
            PublishRecord record = ledger.findRecord("a", "x").get();
            assertEquals(PublishStatus.FAILED, record.status());
            assertTrue(record.error().contains("duplicate content (status 403)"));
            assertEquals(1, metrics.count("dead", "x"));
        }
    }

    @Test
    void transientFailuresRetryWithBackoffUntilDead() {
        x.failNextPublish(new PublishException("bad gateway", 502))
                .failNextPublish(new PublishException("bad gateway", 502))
                .failNextPublish(new PublishException("bad gateway", 502));
        try (Dispatcher d = builder().maxAttempts(3).build()) {
            d.enqueuePublish(item("a", "hello"));
            String key = JobKeys.publish("x", "a");

            d.dispatchDue();
            assertEquals(JobStatus.RETRY, store.get(key).status());
            assertEquals(T0.plusSeconds(10), store.get(key).notBefore());

            clock.advance(Duration.ofSeconds(5));
            assertEquals(0, d.dispatchDue());

            clock.advance(Duration.ofSeconds(5));
            d.dispatchDue();
            assertEquals(2, store.get(key).attempts());
            assertEquals(T0.plusSeconds(30), store.get(key).notBefore());

            clock.advance(Duration.ofSeconds(20));
            d.dispatchDue();
            assertEquals(JobStatus.DEAD, store.get(key).status());
            assertEquals(PublishStatus.FAILED, ledger.findRecord("a", "x").get().status());
            assertEquals(2, metrics.count("retry", "x"));
        }
    }

    @Test
    void failureMidThreadRecordsNothing() {
        // the publisher reports a thread broken after its first post as one failure
        x.failNextPublish(new PublishException("failed at segment 2 of 4", 503));
        try (Dispatcher d = builder().build()) {
            d.enqueuePublish(item("a", "one two three four five six seven eight nine ten"));

            d.dispatchDue();

            assertTrue(ledger.findRecord("a", "x").isEmpty());
            assertTrue(ledger.getTargetsWithRemoteIds("a").isEmpty());
            assertEquals(JobStatus.RETRY, store.get(JobKeys.publish("x", "a")).status());
        }
    }

    // ── Deletes ─────────────────────────────────────────────────────

    @Test
    void deleteWithoutRecordedSuccessIsNoop() {
        try (Dispatcher d = builder().build()) {
            assertEquals(0, d.enqueueDelete("a"));

            Job job = Job.delete(JobKeys.delete("x", "a"), "x", "a", T0, T0);
            store.insertIfAbsent(null, job);
            DispatchOutcome outcome = d.dispatch(job);

            assertInstanceOf(DispatchOutcome.Success.class, outcome);
            assertTrue(x.deleted.isEmpty());
            assertEquals(JobStatus.DONE, store.get(job.jobKey()).status());
        }
    }

    @Test
    void deleteRemovesThreadNewestFirst() {
        RecordingPublisher bsky = new RecordingPublisher("bsky");
        ledger.recordSuccess("a", "x", List.of("x-1", "x-2", "x-3"), null);
        ledger.recordFailure("a", "bsky", "nope");
        try (Dispatcher d = builder().target(profile("bsky"), bsky).build()) {
            assertEquals(1, d.enqueueDelete("a"));

            d.dispatchDue();

            assertEquals(List.of("x-3", "x-2", "x-1"), x.deleted);
            assertTrue(bsky.deleted.isEmpty());
            assertEquals(PublishStatus.DELETED, ledger.findRecord("a", "x").get().status());
            assertTrue(ledger.getTargetsWithRemoteIds("a").isEmpty());
            assertEquals(JobStatus.DONE, store.get(JobKeys.delete("x", "a")).status());
        }
    }

    @Test
    void alreadyGoneRemoteCountsAsDeleted() {
        ledger.recordSuccess("a", "x", List.of("x-1", "x-2"), null);
        x.failNextDelete(PublishException.alreadyGone("no such post"));
        try (Dispatcher d = builder().build()) {
            d.enqueueDelete("a");

            d.dispatchDue();

            assertEquals(List.of("x-1"), x.deleted);
            assertEquals(PublishStatus.DELETED, ledger.findRecord("a", "x").get().status());
        }
    }

    @Test
    void failedDeleteRetriesAndKeepsRecord() {
        ledger.recordSuccess("a", "x", List.of("x-1"), null);
        x.failNextDelete(new PublishException("unavailable", 503));
        try (Dispatcher d = builder().build()) {
            d.enqueueDelete("a");

            d.dispatchDue();

            assertEquals(JobStatus.RETRY, store.get(JobKeys.delete("x", "a")).status());
            assertEquals(PublishStatus.SUCCESS, ledger.findRecord("a", "x").get().status());
        }
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void targetWhosePublisherFailsInitIsDisabled() {
        RecordingPublisher bsky = new RecordingPublisher("bsky");
        bsky.initFailure = new PublishException("bad credentials", 401);
        try (Dispatcher d = builder().target(profile("bsky"), bsky).build()) {
            d.start();

            assertEquals(List.of("x"), d.activeTargets());
            assertEquals(1, d.enqueuePublish(item("a", "hello")));
            assertNull(store.get(JobKeys.publish("bsky", "a")));
        }
    }

    @Test
    void startFailsWhenNoTargetInitializes() {
        x.initFailure = new PublishException("bad credentials", 401);
        try (Dispatcher d = builder().build()) {
            assertThrows(IllegalStateException.class, d::start);
        }
    }

    @Test
    void startedDispatcherPublishesInBackground() throws InterruptedException {
        try (Dispatcher d = builder().clock(java.time.Clock.systemUTC()).fetchIntervalMs(20).build()) {
            d.start();
            d.enqueuePublish(SourceItem.builder("a").createdAt(Instant.now()).text("hello").build());

            long deadline = System.currentTimeMillis() + 5000;
            while (x.published.isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            assertEquals(1, x.published.size());
        }
        assertEquals(1, x.shutdownCount.get());
    }

    @Test
    void closeDropsQueuedAttemptsThatHaveNotStarted() throws InterruptedException {
        x.hold = new CountDownLatch(1);
        TargetProfile single = TargetProfile.builder("x")
                .maxLength(20)
                .lengthCounter(LengthCounter.CODE_POINTS)
                .concurrency(1)
                .build();
        Dispatcher d = builder(single).clock(Clock.systemUTC()).fetchIntervalMs(20).build();
        d.enqueuePublish(item("a", "first"));
        d.enqueuePublish(item("b", "second"));
        d.start();

        long deadline = System.currentTimeMillis() + 5000;
        while (x.publishCalls.get() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, x.publishCalls.get());

        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            x.hold.countDown();
        });
        releaser.start();
        d.close();
        releaser.join();

        assertEquals(1, x.publishCalls.get());
        assertEquals(List.of("x-1"), ledger.getRemoteIds("a", "x"));
        assertEquals(JobStatus.NEW, store.get(JobKeys.publish("x", "b")).status());
    }

    @Test
    void closeIsIdempotent() {
        Dispatcher d = builder().build();
        d.close();
        d.close();

        assertEquals(1, x.shutdownCount.get());
        assertEquals(0, x.initCount.get());
    }

    private Dispatcher.Builder builder() {
        return builder(profile("x"));
    }

    private Dispatcher.Builder builder(TargetProfile xProfile) {
        return Dispatcher.builder()
                .connectionProvider(StubConnections.provider())
                .jobStore(store)
                .ledger(ledger)
                .target(xProfile, x)
                .metrics(metrics)
                .clock(clock)
                .drainTimeoutMs(1000);
    }

    private static TargetProfile profile(String name) {
        return TargetProfile.builder(name).maxLength(20).lengthCounter(LengthCounter.CODE_POINTS).build();
    }

    private static TargetProfile cappedProfile(String name, int dailyLimit) {
        return TargetProfile.builder(name)
                .maxLength(20)
                .lengthCounter(LengthCounter.CODE_POINTS)
                .dailyLimit(dailyLimit)
                .minInterval(Duration.ZERO)
                .concurrency(1)
                .build();
    }

    /** Job store whose poll keeps answering with the due jobs captured by {@link #freeze}. */
    private static final class SnapshotJobStore extends InMemoryJobStore {
        private volatile List<Job> snapshot;

        SnapshotJobStore(Clock clock) {
            super(clock);
        }

        void freeze(String target, Instant now) {
            snapshot = super.pollDue(null, target, now, 50);
        }

        @Override
        public List<Job> pollDue(Connection conn, String target, Instant now, int limit) {
            List<Job> frozen = snapshot;
            return frozen != null ? frozen : super.pollDue(conn, target, now, limit);
        }
    }

    private static SourceItem item(String id, String text) {
        return SourceItem.builder(id).createdAt(T0).text(text).build();
    }

    private static SourceItem reply(String id, String root, String parent) {
        return SourceItem.builder(id).createdAt(T0).text("reply").replyTo(root, parent).build();
    }
}
