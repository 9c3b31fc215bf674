/** Model location adapters. */
package ca.gc.cra.prism.infrastructure.model;
