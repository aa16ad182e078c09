package io.fitwatch.spring.boot;

import io.fitwatch.FitWatcher;
import io.fitwatch.dispatch.LinearBackoffRetryPolicy;
import io.fitwatch.spi.ConversionListener;
import io.fitwatch.spi.FitDecoderFactory;
import io.fitwatch.spi.MetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.List;

/**
 * Auto-configuration for the FIT inbox watcher.
 *
 * <p>Builds a {@link FitWatcher} from {@link FitwatchProperties}, starts it once the bean is
 * initialized and closes it with the context, which drains the queue on SIGTERM or Ctrl-C.
 * Optional {@link MetricsExporter}, {@link FitDecoderFactory} and {@link ConversionListener}
 * beans are picked up when present.
 *
 * @see FitwatchProperties
 * @see FitwatchMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(FitWatcher.class)
@ConditionalOnProperty(prefix = "fitwatch", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(FitwatchProperties.class)
public class FitwatchAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FitwatchAutoConfiguration.class);

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    public FitWatcher fitWatcher(FitwatchProperties props,
                                 ObjectProvider<MetricsExporter> metricsProvider,
                                 ObjectProvider<FitDecoderFactory> decoderProvider,
                                 ObjectProvider<ConversionListener> listenerProvider) {
        var builder = FitWatcher.builder()
                .inbox(Path.of(props.getInbox()))
                .outbox(Path.of(props.getOutbox()))
                .transform(props.isTransform())
                .extension(props.getExtension())
                .maxAttempts(props.getRetry().getMaxAttempts())
                .retryPolicy(new LinearBackoffRetryPolicy(
                        props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
                .pollInterval(props.getStability().getPollInterval())
                .stabilityTimeout(props.getStability().getTimeout())
                .debounceWindow(props.getDebounceWindow())
                .drainTimeout(props.getDrainTimeout());

        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        FitDecoderFactory decoderFactory = decoderProvider.getIfAvailable();
        if (decoderFactory != null) {
            builder.decoderFactory(decoderFactory);
        }
        List<ConversionListener> listeners = listenerProvider.orderedStream().toList();
        if (!listeners.isEmpty()) {
            log.debug("Registering {} conversion listener(s)", listeners.size());
            builder.listener(listeners.size() == 1
                    ? listeners.get(0)
                    : new CompositeConversionListener(listeners));
        }
        return builder.build();
    }
}
