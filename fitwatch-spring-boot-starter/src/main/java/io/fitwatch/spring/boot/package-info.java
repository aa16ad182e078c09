/**
 * Spring Boot auto-configuration for the FIT inbox watcher.
 *
 * <p>Adding the starter to a Spring Boot application creates and starts a
 * {@link io.fitwatch.FitWatcher} bound to {@code fitwatch.*} properties.
 *
 * @see io.fitwatch.spring.boot.FitwatchProperties
 * @see io.fitwatch.spring.boot.FitwatchAutoConfiguration
 */
package io.fitwatch.spring.boot;
