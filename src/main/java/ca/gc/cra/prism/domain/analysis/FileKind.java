package ca.gc.cra.prism.domain.analysis;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of media kinds accepted for analysis.
 * <p><strong>Why:</strong> Detectors dispatch on the kind; anything outside this set is rejected at submission.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum FileKind {
  /** Video container (mp4, mov, mkv, webm, avi). */
  VIDEO("video", "mp4", "m4v", "mov", "mkv", "webm", "avi"),
  /** Still image (jpeg, png, gif, webp, bmp). */
  IMAGE("image", "jpg", "jpeg", "png", "gif", "webp", "bmp"),
  /** Audio stream (wav, mp3, flac, ogg). */
  AUDIO("audio", "wav", "mp3", "flac", "ogg", "oga");

  private final String wireName;
  private final String[] extensions;

  FileKind(String wireName, String... extensions) {
    this.wireName = wireName;
    this.extensions = extensions;
  }

  /**
   * Returns the lowercase name used in records, logs, and JSON output.
   *
   * @return wire name such as {@code video}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Parses a caller-supplied kind.
   *
   * @param raw kind name, case-insensitive
   * @return matching kind
   * @throws AnalysisValidationException if {@code raw} is blank or not a known kind
   */
  public static FileKind fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new AnalysisValidationException("fileKind must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (FileKind kind : values()) {
      if (kind.wireName.equals(normalized)) {
        return kind;
      }
    }
    throw new AnalysisValidationException("Unsupported file kind: " + raw.trim());
  }

  /**
   * Infers a kind from a file name extension.
   *
   * @param fileName file name or path; may be {@code null}
   * @return kind owning the extension, or empty when unknown
   */
  public static Optional<FileKind> fromExtension(String fileName) {
    if (fileName == null) {
      return Optional.empty();
    }
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return Optional.empty();
    }
    String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    for (FileKind kind : values()) {
      for (String candidate : kind.extensions) {
        if (candidate.equals(ext)) {
          return Optional.of(kind);
        }
      }
    }
    return Optional.empty();
  }
}
