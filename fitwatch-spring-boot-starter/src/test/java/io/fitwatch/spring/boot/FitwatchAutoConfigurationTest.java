package io.fitwatch.spring.boot;

import io.fitwatch.ConversionReport;
import io.fitwatch.FitWatcher;
import io.fitwatch.spi.ConversionListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class FitwatchAutoConfigurationTest {

  @TempDir
  Path root;

  private ApplicationContextRunner runner() {
    return new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(FitwatchAutoConfiguration.class))
        .withPropertyValues(
            "fitwatch.inbox=" + root.resolve("in"),
            "fitwatch.outbox=" + root.resolve("out"),
            "fitwatch.stability.poll-interval=20ms",
            "fitwatch.stability.timeout=1s");
  }

  @Test
  void createsAndStartsWatcher() {
    runner().run(ctx -> {
      assertTrue(ctx.containsBean("fitWatcher"));
      FitWatcher watcher = ctx.getBean(FitWatcher.class);
      assertEquals(root.resolve("in").toAbsolutePath(), watcher.inbox());
      assertTrue(Files.isDirectory(root.resolve("in")));
      assertTrue(Files.isDirectory(root.resolve("out")));
    });
  }

  @Test
  void propertiesReachTheWatcher() {
    runner()
        .withPropertyValues(
            "fitwatch.transform=false",
            "fitwatch.retry.max-attempts=7",
            "fitwatch.debounce-window=9s")
        .run(ctx -> {
          FitWatcher.Settings settings = ctx.getBean(FitWatcher.class).settings();
          assertFalse(settings.transform());
          assertEquals(7, settings.maxAttempts());
          assertEquals(Duration.ofSeconds(9), settings.debounceWindow());
          assertEquals(Duration.ofMillis(20), settings.pollInterval());
        });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner().withPropertyValues("fitwatch.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("fitWatcher"));
      assertFalse(Files.exists(root.resolve("in")));
    });
  }

  @Test
  void backsOffWhenUserDefinesWatcher() {
    runner().withUserConfiguration(CustomWatcherConfig.class).run(ctx -> {
      assertEquals(1, ctx.getBeansOfType(FitWatcher.class).size());
      assertTrue(ctx.containsBean("customWatcher"));
    });
  }

  @Test
  void contextCloseStopsWatcher() {
    FitWatcher[] holder = new FitWatcher[1];
    runner().run(ctx -> holder[0] = ctx.getBean(FitWatcher.class));

    assertThrows(IllegalStateException.class, holder[0]::start);
    assertTrue(holder[0].isStopRequested());
  }

  @Test
  void invalidSettingsFailStartup() {
    runner().withPropertyValues("fitwatch.retry.max-attempts=0").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
    });
  }

  // ── Listeners ───────────────────────────────────────────────────

  @Test
  void multipleListenerBeansDoNotConflict() {
    runner().withUserConfiguration(TwoListenersConfig.class).run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertNotNull(ctx.getBean(FitWatcher.class));
    });
  }

  @Test
  void compositeCallsListenersInOrder() {
    List<String> calls = new CopyOnWriteArrayList<>();
    CompositeConversionListener composite = new CompositeConversionListener(List.of(
        retryRecorder(calls, "first"), retryRecorder(calls, "second")));

    composite.onRetry(root.resolve("a.fit"), 1, "boom");

    assertEquals(List.of("first", "second"), calls);
  }

  @Test
  void failingListenerDoesNotStopTheRest() {
    List<String> calls = new CopyOnWriteArrayList<>();
    CompositeConversionListener composite = new CompositeConversionListener(List.of(
        new ConversionListener() {
          @Override
          public void onAbandoned(ConversionReport report) {
            throw new IllegalStateException("boom");
          }
        },
        new ConversionListener() {
          @Override
          public void onAbandoned(ConversionReport report) {
            calls.add(report.message());
          }
        }));

    composite.onAbandoned(ConversionReport.failure(root.resolve("x.fit"), root.resolve("x.csv"), "bad", 1));

    assertEquals(1, calls.size());
  }

  @Configuration
  static class CustomWatcherConfig {
    @Bean(destroyMethod = "close")
    FitWatcher customWatcher() {
      return FitWatcher.builder()
          .inbox(Path.of("custom-in"))
          .outbox(Path.of("custom-out"))
          .build();
    }
  }

  @Configuration
  static class TwoListenersConfig {
    @Bean
    ConversionListener first() {
      return retryRecorder(new CopyOnWriteArrayList<>(), "first");
    }

    @Bean
    ConversionListener second() {
      return retryRecorder(new CopyOnWriteArrayList<>(), "second");
    }
  }

  private static ConversionListener retryRecorder(List<String> calls, String name) {
    return new ConversionListener() {
      @Override
      public void onRetry(Path input, int attempt, String detail) {
        calls.add(name);
      }
    };
  }
}
