package syndicator.spring.boot;

import syndicator.TargetProfile;
import syndicator.dispatch.Dispatcher;
import syndicator.dispatch.ExponentialBackoffRetryPolicy;
import syndicator.jdbc.DataSourceConnectionProvider;
import syndicator.jdbc.ledger.AbstractJdbcLedger;
import syndicator.jdbc.ledger.JdbcLedgers;
import syndicator.jdbc.store.AbstractJdbcJobStore;
import syndicator.jdbc.store.JdbcJobStores;
import syndicator.ledger.Ledger;
import syndicator.poller.SourcePoller;
import syndicator.purge.JobPurgeScheduler;
import syndicator.segment.LengthCounter;
import syndicator.segment.WeightedLengthCounter;
import syndicator.spi.ConnectionProvider;
import syndicator.spi.JobStore;
import syndicator.spi.MetricsExporter;
import syndicator.spi.Publisher;
import syndicator.spi.SourceFeed;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the syndication pipeline.
 *
 * <p>Wires the JDBC ledger and job store detected from the {@link DataSource}, a
 * {@link Dispatcher} over every {@link Publisher} bean with a matching
 * {@code syndicator.targets.<name>} entry, and a {@link SourcePoller} when a
 * {@link SourceFeed} bean exists.
 *
 * @see SyndicatorProperties
 * @see SyndicatorMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Dispatcher.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "syndicator", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SyndicatorProperties.class)
public class SyndicatorAutoConfiguration {
  private static final Logger logger = Logger.getLogger(SyndicatorAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean(Ledger.class)
  public AbstractJdbcLedger ledger(DataSource dataSource) {
    return JdbcLedgers.forDataSource(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(JobStore.class)
  public AbstractJdbcJobStore jobStore(DataSource dataSource) {
    return JdbcJobStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(Publisher.class)
  public Dispatcher dispatcher(SyndicatorProperties props,
      ConnectionProvider connectionProvider,
      JobStore jobStore,
      Ledger ledger,
      ObjectProvider<Publisher> publisherProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var dp = props.getDispatcher();
    var retry = props.getRetry();
    var builder = Dispatcher.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .ledger(ledger)
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.isJitter()))
        .maxAttempts(dp.getMaxAttempts())
        .batchSize(dp.getBatchSize())
        .fetchIntervalMs(dp.getFetchIntervalMs())
        .drainTimeoutMs(dp.getDrainTimeoutMs())
        .rateLimitFloor(Duration.ofMillis(dp.getRateLimitFloorMs()))
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));

    Map<String, SyndicatorProperties.Target> targets = props.getTargets();
    List<Publisher> publishers = publisherProvider.orderedStream().toList();
    int matched = 0;
    for (Publisher publisher : publishers) {
      SyndicatorProperties.Target target = targets.get(publisher.name());
      if (target == null) {
        logger.log(Level.WARNING, "Publisher {0} has no syndicator.targets entry; skipped", publisher.name());
        continue;
      }
      builder.target(profile(publisher.name(), target), publisher);
      matched++;
    }
    for (String name : targets.keySet()) {
      if (publishers.stream().noneMatch(p -> p.name().equals(name))) {
        logger.log(Level.WARNING, "Target {0} is configured but no Publisher bean serves it", name);
      }
    }
    if (matched == 0) {
      throw new IllegalStateException("No Publisher bean matches a configured target: " + targets.keySet());
    }
    return builder.build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean({SourceFeed.class, Dispatcher.class})
  @ConditionalOnProperty(prefix = "syndicator.poller", name = "enabled", matchIfMissing = true)
  public SourcePoller sourcePoller(SyndicatorProperties props,
      SourceFeed feed,
      Ledger ledger,
      Dispatcher dispatcher,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var pp = props.getPoller();
    return SourcePoller.builder()
        .feed(feed)
        .ledger(ledger)
        .dispatcher(dispatcher)
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .feedLimit(pp.getFeedLimit())
        .intervalMs(pp.getIntervalMs())
        .reconcileIntervalMs(pp.getReconcileIntervalMs())
        .build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "syndicator.purge", name = "enabled", havingValue = "true")
  public JobPurgeScheduler jobPurgeScheduler(SyndicatorProperties props,
      ConnectionProvider connectionProvider,
      JobStore jobStore) {
    var pp = props.getPurge();
    return JobPurgeScheduler.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .retention(pp.getRetention())
        .batchSize(pp.getBatchSize())
        .intervalSeconds(pp.getIntervalSeconds())
        .build();
  }

  static TargetProfile profile(String name, SyndicatorProperties.Target target) {
    var builder = TargetProfile.builder(name)
        .maxLength(target.getMaxLength())
        .lengthCounter(lengthCounter(target.getCounter()))
        .reserveForCounter(target.getReserveForCounter())
        .concurrency(target.getConcurrency())
        .dailyLimit(target.getDailyLimit())
        .remoteLinkFormat(target.getRemoteLinkFormat());
    if (target.getMinIntervalMs() != null) {
      builder.minInterval(Duration.ofMillis(target.getMinIntervalMs()));
    }
    return builder.build();
  }

  private static LengthCounter lengthCounter(SyndicatorProperties.Counter counter) {
    return switch (counter) {
      case CODE_POINTS -> LengthCounter.CODE_POINTS;
      case GRAPHEMES -> LengthCounter.GRAPHEMES;
      case WEIGHTED -> new WeightedLengthCounter();
    };
  }
}
