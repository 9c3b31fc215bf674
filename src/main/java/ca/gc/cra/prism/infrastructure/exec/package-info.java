/**
 * Executor factories for dispatcher, detector, and housekeeping threads.
 * <p>Dispatcher and detector threads are non-daemon so a graceful drain completes before JVM exit;
 * housekeeping threads are daemons.</p>
 */
package ca.gc.cra.prism.infrastructure.exec;
