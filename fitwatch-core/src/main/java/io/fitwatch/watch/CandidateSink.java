package io.fitwatch.watch;

/**
 * Receives candidate files from a {@link DirectoryEventSource}.
 *
 * <p>Called on the event thread. Implementations must not block on conversion work.
 */
@FunctionalInterface
public interface CandidateSink {
  void onCandidate(CandidatePath candidate);
}
