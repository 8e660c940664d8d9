/**
 * Internal utilities.
 */
package syndicator.util;
