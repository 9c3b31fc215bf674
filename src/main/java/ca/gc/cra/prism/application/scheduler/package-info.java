/**
 * Priority-tiered analysis scheduling: bounded tier queues, dedicated dispatcher threads per tier,
 * detector offload, lifecycle tracking, cleanup, and aggregate metrics.
 *
 * <p>{@link ca.gc.cra.prism.application.scheduler.AnalysisScheduler} is the entry point.</p>
 */
package ca.gc.cra.prism.application.scheduler;
