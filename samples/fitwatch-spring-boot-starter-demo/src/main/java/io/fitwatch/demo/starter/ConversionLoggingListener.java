package io.fitwatch.demo.starter;

import io.fitwatch.ConversionReport;
import io.fitwatch.spi.ConversionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class ConversionLoggingListener implements ConversionListener {

    private static final Logger log = LoggerFactory.getLogger(ConversionLoggingListener.class);

    @Override
    public void onConverted(ConversionReport report) {
        log.info("[Listener] {} ({} attempt(s))", report.message(), report.attempts());
    }

    @Override
    public void onRetry(Path input, int attempt, String detail) {
        log.info("[Listener] retrying {} after attempt {}: {}", input.getFileName(), attempt, detail);
    }
}
