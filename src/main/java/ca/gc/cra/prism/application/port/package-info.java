/**
 * <strong>Purpose:</strong> Ports defining the submit -> dispatch -> detect -> record workflow contracts.
 * <p><strong>Pipeline role:</strong> Application boundary; adapters implement these interfaces to plug in
 * detectors, model locations, result storage, clocks, and metrics backends.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.application.port;
