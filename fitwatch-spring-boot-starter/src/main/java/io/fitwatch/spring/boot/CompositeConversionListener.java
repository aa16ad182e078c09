package io.fitwatch.spring.boot;

import io.fitwatch.ConversionReport;
import io.fitwatch.spi.ConversionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fans each callback out to several listener beans in order. A failing listener is logged
 * and does not stop the ones after it.
 */
final class CompositeConversionListener implements ConversionListener {

    private static final Logger log = LoggerFactory.getLogger(CompositeConversionListener.class);

    private final List<ConversionListener> delegates;

    CompositeConversionListener(List<ConversionListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void onConverted(ConversionReport report) {
        each(listener -> listener.onConverted(report));
    }

    @Override
    public void onRetry(Path input, int attempt, String detail) {
        each(listener -> listener.onRetry(input, attempt, detail));
    }

    @Override
    public void onAbandoned(ConversionReport report) {
        each(listener -> listener.onAbandoned(report));
    }

    private void each(Consumer<ConversionListener> call) {
        for (ConversionListener listener : delegates) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Conversion listener {} failed", listener.getClass().getName(), e);
            }
        }
    }
}
