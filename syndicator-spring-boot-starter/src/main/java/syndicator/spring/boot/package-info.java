/**
 * Spring Boot auto-configuration binding {@code syndicator.*} properties.
 */
package syndicator.spring.boot;
