/**
 * Service provider interfaces: the external collaborators ({@link syndicator.spi.SourceFeed},
 * {@link syndicator.spi.Publisher}) and the persistence and observability seams.
 */
package syndicator.spi;
