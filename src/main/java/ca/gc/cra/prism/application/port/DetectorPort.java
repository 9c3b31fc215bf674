package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.analysis.AnalysisException;
import ca.gc.cra.prism.domain.analysis.DetectionResult;
import ca.gc.cra.prism.domain.analysis.FileKind;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Domain port for the opaque media analysis capability.
 * <p><strong>Why:</strong> The scheduler coordinates jobs without knowing how frames, faces, or audio
 * features are evaluated.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code FileSignatureDetector}; invoked on the
 * bounded detector pool, never on a dispatcher thread.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent {@link #analyze} calls from
 * every detector thread.</p>
 * <p><strong>Performance:</strong> Calls may take seconds; the scheduler sizes its pool accordingly.</p>
 *
 * @since 0.1.0
 */
public interface DetectorPort extends AutoCloseable {
  /**
   * Indicates whether this detector can analyze the given kind.
   *
   * @param kind media kind
   * @return {@code true} when {@link #analyze} accepts the kind
   */
  boolean supports(FileKind kind);

  /**
   * Analyzes a media file.
   *
   * @param fileRef file reference as submitted
   * @param kind media kind declared at submission
   * @return detector payload
   * @throws AnalysisException if the file cannot be read or evaluated
   */
  DetectionResult analyze(String fileRef, FileKind kind) throws AnalysisException;

  /**
   * Releases model resources. Default implementation does nothing.
   */
  @Override
  default void close() {}

  /**
   * Opens a detector bound to a resolved model location.
   *
   * <p>Invoked once when the scheduler starts, not per job.</p>
   */
  @FunctionalInterface
  interface Factory {
    /**
     * Loads the detector model.
     *
     * @param modelPath path returned by {@link ModelLocatorPort}
     * @return ready detector
     * @throws AnalysisException if the model cannot be loaded
     */
    DetectorPort open(Path modelPath) throws AnalysisException;
  }
}
