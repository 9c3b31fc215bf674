/**
 * Core domain model for PRISM media analysis scheduling.
 * <p><strong>Role:</strong> Domain layer types describing analysis jobs without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across dispatcher threads.</p>
 */
package ca.gc.cra.prism.domain;
