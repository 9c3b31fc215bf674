package ca.gc.cra.prism.domain.analysis;

import java.util.Objects;

/**
 * Immutable descriptor of one analysis submission.
 *
 * <p>Owned by its tier queue until dequeued, then by the worker executing it.</p>
 *
 * @param fileRef reference to the media file (path or URI); never blank
 * @param fileKind kind of media
 * @param analysisId unique identifier assigned at submission
 * @param submitter identity of the caller that submitted the job; never blank
 * @param priority tier the job is queued on
 * @since 0.1.0
 */
public record AnalysisRequest(
    String fileRef, FileKind fileKind, String analysisId, String submitter, Priority priority) {

  /**
   * Validates descriptor fields.
   *
   * @throws NullPointerException if any field is {@code null}
   * @throws AnalysisValidationException if a text field is blank
   */
  public AnalysisRequest {
    Objects.requireNonNull(fileRef, "fileRef");
    Objects.requireNonNull(fileKind, "fileKind");
    Objects.requireNonNull(analysisId, "analysisId");
    Objects.requireNonNull(submitter, "submitter");
    Objects.requireNonNull(priority, "priority");
    if (fileRef.isBlank()) {
      throw new AnalysisValidationException("fileRef must not be blank");
    }
    if (analysisId.isBlank()) {
      throw new AnalysisValidationException("analysisId must not be blank");
    }
    if (submitter.isBlank()) {
      throw new AnalysisValidationException("submitter must not be blank");
    }
  }
}
