/**
 * Input validation helpers shared by configuration loading and the CLI.
 */
package ca.gc.cra.prism.validation;
