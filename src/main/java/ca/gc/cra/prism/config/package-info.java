/**
 * Configuration loading (defaults, YAML, CLI overrides) and the composition root that wires the
 * scheduler to its adapters.
 */
package ca.gc.cra.prism.config;
