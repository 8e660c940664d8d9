/**
 * Persistent job model shared by the dispatcher and {@link syndicator.spi.JobStore} implementations.
 */
package syndicator.model;
