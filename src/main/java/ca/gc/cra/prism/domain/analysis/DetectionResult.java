package ca.gc.cra.prism.domain.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Payload produced by a detector for a completed job.
 * <p><strong>Role:</strong> Stored inside a successful {@link JobOutcome} and returned to callers.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are copied on construction.</p>
 *
 * @param verdict detector conclusion
 * @param confidence confidence in {@code [0, 1]}
 * @param anomalies human-readable anomaly descriptions; may be empty
 * @param frameFindings per-frame scores; empty for audio
 * @param diagnostics free-form detector diagnostics, insertion ordered
 * @since 0.1.0
 */
public record DetectionResult(
    Verdict verdict,
    double confidence,
    List<String> anomalies,
    List<FrameFinding> frameFindings,
    Map<String, String> diagnostics) {

  /**
   * Validates and copies detector output.
   *
   * @throws NullPointerException if {@code verdict} is {@code null}
   * @throws IllegalArgumentException if {@code confidence} is outside {@code [0, 1]}
   */
  public DetectionResult {
    Objects.requireNonNull(verdict, "verdict");
    if (confidence < 0d || confidence > 1d || Double.isNaN(confidence)) {
      throw new IllegalArgumentException("confidence must be within [0, 1] (was " + confidence + ")");
    }
    anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    frameFindings = frameFindings == null ? List.of() : List.copyOf(frameFindings);
    diagnostics =
        diagnostics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
  }

  /**
   * Confidence scaled to a 0-100 score.
   *
   * @return {@code confidence * 100}
   */
  public double overallScore() {
    return confidence * 100d;
  }
}
