/**
 * Retention of terminal jobs.
 */
package syndicator.purge;
