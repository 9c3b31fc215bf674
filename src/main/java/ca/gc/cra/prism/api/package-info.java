/**
 * Command-line entry points: the {@code prism} dispatcher and the {@code analyze} command, with their
 * argument parsing, telemetry wiring, and exit codes.
 */
package ca.gc.cra.prism.api;
