package io.fitwatch.demo.starter;

import io.fitwatch.ConversionReport;
import io.fitwatch.spi.ConversionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Escalates files the watcher gave up on. A real deployment would page or notify here.
 */
@Component
public class AbandonedFileAlert implements ConversionListener {

    private static final Logger log = LoggerFactory.getLogger(AbandonedFileAlert.class);

    @Override
    public void onAbandoned(ConversionReport report) {
        log.error("[Alert] {} needs attention: {}", report.input(), report.message());
    }
}
