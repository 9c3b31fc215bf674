package ca.gc.cra.prism.application.scheduler;

/**
 * Untyped submission as received from an outer surface (CLI, HTTP layer).
 *
 * <p>Fields are validated by {@link AnalysisScheduler#submit(String, String, String, int)}, not here.</p>
 *
 * @param fileRef media reference
 * @param fileKind kind name ({@code video}, {@code image}, {@code audio})
 * @param submitter submitting identity
 * @param priority numeric tier (1=normal, 2=high, 3=critical)
 * @since 0.1.0
 */
public record SubmissionRequest(String fileRef, String fileKind, String submitter, int priority) {}
