/**
 * Source items, target profiles and the publish request and result types shared by the
 * syndication pipeline.
 *
 * @see syndicator.dispatch.Dispatcher
 * @see syndicator.poller.SourcePoller
 */
package syndicator;
