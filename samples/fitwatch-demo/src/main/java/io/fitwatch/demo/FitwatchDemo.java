package io.fitwatch.demo;

import io.fitwatch.ConversionReport;
import io.fitwatch.FitWatcher;
import io.fitwatch.spi.ConversionListener;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Watches a directory without Spring and converts every FIT file dropped into it.
 * <p>
 * Run with: mvn -pl samples/fitwatch-demo exec:java -Dexec.args="inbox outbox [--raw]"
 * <p>
 * Ctrl-C stops the watcher after the queued files are converted.
 */
public final class FitwatchDemo {

    public static void main(String[] args) throws Exception {
        Path inbox = Path.of(args.length > 0 ? args[0] : "inbox");
        Path outbox = Path.of(args.length > 1 ? args[1] : "outbox");
        boolean transform = !(args.length > 2 && args[2].equals("--raw"));

        AtomicInteger converted = new AtomicInteger();
        AtomicInteger abandoned = new AtomicInteger();

        FitWatcher watcher = FitWatcher.builder()
                .inbox(inbox)
                .outbox(outbox)
                .transform(transform)
                .listener(new ConversionListener() {
                    @Override
                    public void onConverted(ConversionReport report) {
                        System.out.println("[OK]   " + report.message());
                        converted.incrementAndGet();
                    }

                    @Override
                    public void onRetry(Path input, int attempt, String detail) {
                        System.out.println("[RETRY] " + input.getFileName() + " attempt " + attempt + ": " + detail);
                    }

                    @Override
                    public void onAbandoned(ConversionReport report) {
                        System.out.println("[FAIL] " + report.message());
                        abandoned.incrementAndGet();
                    }
                })
                .build();

        Thread main = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            watcher.requestStop();
            try {
                main.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "fitwatch-shutdown"));

        try (watcher) {
            watcher.start();
            System.out.println("=== FIT Watch Demo ===");
            System.out.println("Drop .fit files into " + watcher.inbox() + " (Ctrl-C to stop)\n");
            watcher.awaitStop();
            System.out.println("\nStopping, draining queue...");
        } // close() drains the queue before returning

        System.out.println("Converted " + converted.get() + ", failed " + abandoned.get() + ".");
    }
}
