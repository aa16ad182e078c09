package io.fitwatch.dispatch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Unit of work in the {@link ConversionDispatcher} queue.
 */
public sealed interface Task permits Task.Convert, Task.Stop {

  /** Convert one file. */
  record Convert(Path path) implements Task {
    public Convert {
      Objects.requireNonNull(path, "path");
    }
  }

  /** Sentinel: the worker exits after taking it. Every task queued before it runs first. */
  enum Stop implements Task {
    INSTANCE
  }
}
