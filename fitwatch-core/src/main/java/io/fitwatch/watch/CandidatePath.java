package io.fitwatch.watch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file that a filesystem event suggests is ready for conversion.
 *
 * @param path           absolute, normalized path
 * @param observedAtNanos {@link System#nanoTime()} when the event was seen
 */
public record CandidatePath(Path path, long observedAtNanos) {

  public CandidatePath {
    Objects.requireNonNull(path, "path");
    path = path.toAbsolutePath().normalize();
  }

  public static CandidatePath of(Path path) {
    return new CandidatePath(path, System.nanoTime());
  }
}
