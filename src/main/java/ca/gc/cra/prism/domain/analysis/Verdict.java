package ca.gc.cra.prism.domain.analysis;

/** Detector conclusion about a media file. */
public enum Verdict {
  /** No sign of manipulation. */
  AUTHENTIC,
  /** Synthetic or manipulated content detected. */
  MANIPULATED,
  /** The detector could not decide. */
  INCONCLUSIVE
}
