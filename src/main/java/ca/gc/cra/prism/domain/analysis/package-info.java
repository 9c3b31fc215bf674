/**
 * Analysis job domain: descriptors, lifecycle states, tagged outcomes, and identifier generation.
 * <p><strong>Concurrency:</strong> All types are immutable; job records change by replacement, never in place.</p>
 * <p><strong>Validation:</strong> Closed enums for file kind and priority reject unknown values at the
 * submission boundary with {@link ca.gc.cra.prism.domain.analysis.AnalysisValidationException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.domain.analysis;
