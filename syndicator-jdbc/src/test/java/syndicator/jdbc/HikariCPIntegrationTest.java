package syndicator.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import syndicator.PublishRequest;
import syndicator.PublishResult;
import syndicator.SourceItem;
import syndicator.TargetProfile;
import syndicator.dispatch.Dispatcher;
import syndicator.dispatch.JobKeys;
import syndicator.jdbc.ledger.AbstractJdbcLedger;
import syndicator.jdbc.ledger.JdbcLedgers;
import syndicator.jdbc.store.AbstractJdbcJobStore;
import syndicator.jdbc.store.JdbcJobStores;
import syndicator.ledger.PublishStatus;
import syndicator.model.Job;
import syndicator.model.JobStatus;
import syndicator.poller.SourcePoller;
import syndicator.spi.Publisher;
import syndicator.spi.SourceFeed;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private HikariDataSource hikariDs;
  private DataSourceConnectionProvider connectionProvider;
  private AbstractJdbcLedger ledger;
  private AbstractJdbcJobStore jobStore;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(H2Databases.randomUrl("hikari"));
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("syndicator-test-pool");

    hikariDs = new HikariDataSource(config);
    H2Databases.applySchema(hikariDs);
    connectionProvider = new DataSourceConnectionProvider(hikariDs);
    ledger = JdbcLedgers.forDataSource(hikariDs);
    jobStore = JdbcJobStores.detect(hikariDs);
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void pollPublishAndReconcileThroughPool() throws Exception {
    ListFeed feed = new ListFeed();
    feed.items.add(item("p2", T0.plusSeconds(60), "second post"));
    feed.items.add(item("p1", T0, "first post"));
    CountingPublisher publisher = new CountingPublisher("bluesky");

    try (Dispatcher dispatcher = dispatcher(publisher);
         SourcePoller poller = poller(feed, dispatcher)) {
      assertEquals(2, poller.poll());
      assertEquals(0, poller.poll());
      assertEquals(2, countJobs(JobStatus.NEW));

      assertEquals(2, dispatcher.dispatchDue());

      assertEquals(List.of("first post", "second post"), publisher.texts());
      assertEquals(List.of("bluesky-1"), ledger.getRemoteIds("p1", "bluesky"));
      assertEquals(List.of("bluesky-2"), ledger.getRemoteIds("p2", "bluesky"));
      assertEquals(2, countJobs(JobStatus.DONE));

      feed.items.removeIf(i -> i.id().equals("p1"));
      assertEquals(1, poller.reconcile());
      assertTrue(ledger.isDeleted("p1"));
      assertEquals(1, dispatcher.dispatchDue());

      assertEquals(List.of("bluesky-1"), publisher.deleted);
      assertEquals(PublishStatus.DELETED, ledger.findRecord("p1", "bluesky").orElseThrow().status());
      assertEquals(Set.of("p2"), ledger.listActiveIds());
    }
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void repliesAttachAfterParentPublishes() throws Exception {
    ListFeed feed = new ListFeed();
    feed.items.add(SourceItem.builder("p2").createdAt(T0.plusSeconds(5)).text("reply")
        .replyTo("p1", "p1").build());
    feed.items.add(item("p1", T0, "root"));
    CountingPublisher publisher = new CountingPublisher("x");

    try (Dispatcher dispatcher = dispatcher(publisher);
         SourcePoller poller = poller(feed, dispatcher)) {
      poller.poll();
      for (int i = 0; i < 3 && countJobs(JobStatus.DONE) < 2; i++) {
        dispatcher.dispatchDue();
      }

      assertEquals(2, countJobs(JobStatus.DONE));
      assertEquals(List.of("x-1"), publisher.replyTargets());
    }
  }

  @Test
  void backgroundDispatchReleasesConnections() throws Exception {
    CountingPublisher publisher = new CountingPublisher("bluesky");

    try (Dispatcher dispatcher = dispatcher(publisher)) {
      dispatcher.start();
      for (int i = 0; i < 20; i++) {
        dispatcher.enqueuePublish(item("p" + i, T0.plusSeconds(i), "post " + i));
      }

      long deadline = System.currentTimeMillis() + 5_000;
      while (countJobs(JobStatus.DONE) < 20 && System.currentTimeMillis() < deadline) {
        Thread.sleep(25);
      }
      assertEquals(20, countJobs(JobStatus.DONE));
    }
    assertEquals(20, publisher.requests.size());
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void reEnqueueOfCompletedItemIsCollapsed() throws Exception {
    CountingPublisher publisher = new CountingPublisher("bluesky");

    try (Dispatcher dispatcher = dispatcher(publisher)) {
      SourceItem item = item("p1", T0, "once");
      assertEquals(1, dispatcher.enqueuePublish(item));
      dispatcher.dispatchDue();
      assertEquals(0, dispatcher.enqueuePublish(item));

      try (Connection conn = hikariDs.getConnection()) {
        Job job = jobStore.find(conn, JobKeys.publish("bluesky", "p1")).orElseThrow();
        assertEquals(JobStatus.DONE, job.status());
      }
    }
    assertEquals(1, publisher.requests.size());
  }

  private Dispatcher dispatcher(CountingPublisher publisher) {
    return Dispatcher.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .ledger(ledger)
        .target(TargetProfile.builder(publisher.name()).maxLength(300).concurrency(2).build(), publisher)
        .fetchIntervalMs(20)
        .drainTimeoutMs(1_000)
        .build();
  }

  private SourcePoller poller(SourceFeed feed, Dispatcher dispatcher) {
    return SourcePoller.builder()
        .feed(feed)
        .ledger(ledger)
        .dispatcher(dispatcher)
        .build();
  }

  private static SourceItem item(String id, Instant createdAt, String text) {
    return SourceItem.builder(id).createdAt(createdAt).text(text).build();
  }

  private int countJobs(JobStatus status) throws SQLException {
    try (Connection conn = hikariDs.getConnection();
         var ps = conn.prepareStatement("SELECT COUNT(*) FROM syndication_job WHERE status=?")) {
      ps.setInt(1, status.code());
      try (var rs = ps.executeQuery()) {
        rs.next();
        return rs.getInt(1);
      }
    }
  }

  private static final class ListFeed implements SourceFeed {
    final List<SourceItem> items = new CopyOnWriteArrayList<>();

    @Override
    public List<SourceItem> fetchRecentOwnItems(int limit) {
      return new ArrayList<>(items.subList(0, Math.min(limit, items.size())));
    }

    @Override
    public Set<String> fetchAllLiveIds() {
      Set<String> ids = new LinkedHashSet<>();
      for (SourceItem item : items) {
        ids.add(item.id());
      }
      return ids;
    }
  }

  private static final class CountingPublisher implements Publisher {
    private final String name;
    private final AtomicInteger sequence = new AtomicInteger();
    final List<PublishRequest> requests = new CopyOnWriteArrayList<>();
    final List<String> deleted = new CopyOnWriteArrayList<>();

    CountingPublisher(String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public PublishResult publish(PublishRequest request) {
      requests.add(request);
      List<String> ids = new ArrayList<>();
      for (int i = 0; i < request.segments().size(); i++) {
        ids.add(name + "-" + sequence.incrementAndGet());
      }
      return new PublishResult(ids, "https://" + name + ".example/" + ids.get(0));
    }

    @Override
    public void delete(String remoteId) {
      deleted.add(remoteId);
    }

    List<String> texts() {
      return requests.stream().map(r -> String.join(" ", r.segments())).toList();
    }

    List<String> replyTargets() {
      return requests.stream().filter(PublishRequest::isReply).map(PublishRequest::replyToRemoteId).toList();
    }
  }
}
