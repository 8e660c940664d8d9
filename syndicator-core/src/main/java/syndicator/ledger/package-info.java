/**
 * Durable state of the pipeline: seen and deleted source items, per-target publish records and
 * daily budget counters. The JDBC implementation lives in {@code syndicator-jdbc}.
 */
package syndicator.ledger;
