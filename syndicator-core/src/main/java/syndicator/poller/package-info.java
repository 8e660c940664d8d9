/**
 * Source feed polling and deletion reconciliation.
 *
 * @see syndicator.poller.SourcePoller
 */
package syndicator.poller;
