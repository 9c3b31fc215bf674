/**
 * Logging helpers: bounded failure detail and runtime verbosity control over Logback.
 */
package ca.gc.cra.prism.logging;
