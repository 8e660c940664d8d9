/**
 * Cross-target dependency handling: reply anchoring through {@link syndicator.resolve.DependencyResolver}
 * and quote text through {@link syndicator.resolve.QuoteComposer}.
 */
package syndicator.resolve;
