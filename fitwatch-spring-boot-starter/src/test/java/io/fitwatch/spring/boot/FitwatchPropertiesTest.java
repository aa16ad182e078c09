package io.fitwatch.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FitwatchPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(FitwatchProperties.class);
            assertTrue(props.isEnabled());
            assertEquals("inbox", props.getInbox());
            assertEquals("outbox", props.getOutbox());
            assertTrue(props.isTransform());
            assertEquals(".fit", props.getExtension());
            assertEquals(Duration.ofSeconds(2), props.getDebounceWindow());
            assertEquals(Duration.ofSeconds(30), props.getDrainTimeout());
            assertEquals(3, props.getRetry().getMaxAttempts());
            assertEquals(250, props.getRetry().getBaseDelayMs());
            assertEquals(1000, props.getRetry().getMaxDelayMs());
            assertEquals(Duration.ofMillis(500), props.getStability().getPollInterval());
            assertEquals(Duration.ofSeconds(30), props.getStability().getTimeout());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("fitwatch", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "fitwatch.enabled=false",
                "fitwatch.inbox=/data/garmin/in",
                "fitwatch.outbox=/data/garmin/out",
                "fitwatch.transform=false",
                "fitwatch.extension=FIT",
                "fitwatch.debounce-window=5s",
                "fitwatch.drain-timeout=PT1M",
                "fitwatch.retry.max-attempts=5",
                "fitwatch.retry.base-delay-ms=100",
                "fitwatch.retry.max-delay-ms=400",
                "fitwatch.stability.poll-interval=250ms",
                "fitwatch.stability.timeout=10s",
                "fitwatch.metrics.enabled=false",
                "fitwatch.metrics.name-prefix=garmin.fitwatch"
        ).run(ctx -> {
            var props = ctx.getBean(FitwatchProperties.class);
            assertFalse(props.isEnabled());
            assertEquals("/data/garmin/in", props.getInbox());
            assertEquals("/data/garmin/out", props.getOutbox());
            assertFalse(props.isTransform());
            assertEquals("FIT", props.getExtension());
            assertEquals(Duration.ofSeconds(5), props.getDebounceWindow());
            assertEquals(Duration.ofMinutes(1), props.getDrainTimeout());
            assertEquals(5, props.getRetry().getMaxAttempts());
            assertEquals(100, props.getRetry().getBaseDelayMs());
            assertEquals(400, props.getRetry().getMaxDelayMs());
            assertEquals(Duration.ofMillis(250), props.getStability().getPollInterval());
            assertEquals(Duration.ofSeconds(10), props.getStability().getTimeout());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("garmin.fitwatch", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(FitwatchProperties.class)
    static class PropsConfig {
    }
}
