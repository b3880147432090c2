/**
 * Spring Boot auto-configuration for sqlgate.
 *
 * @see sqlgate.spring.boot.SqlGateAutoConfiguration
 * @see sqlgate.spring.boot.SqlGateMicrometerAutoConfiguration
 * @see sqlgate.spring.boot.SqlGateProperties
 */
package sqlgate.spring.boot;
