package ca.gc.cra.prism.domain.analysis;

/**
 * Per-frame score reported by video or image detectors.
 *
 * @param index zero-based frame index (0 for still images)
 * @param score manipulation score in {@code [0, 1]}
 * @param facesDetected number of faces located in the frame
 * @since 0.1.0
 */
public record FrameFinding(int index, double score, int facesDetected) {
  /**
   * Validates frame values.
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  public FrameFinding {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
    if (score < 0d || score > 1d || Double.isNaN(score)) {
      throw new IllegalArgumentException("score must be within [0, 1]");
    }
    if (facesDetected < 0) {
      throw new IllegalArgumentException("facesDetected must be >= 0");
    }
  }
}
