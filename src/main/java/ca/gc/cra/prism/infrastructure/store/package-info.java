/** Result store adapters. */
package ca.gc.cra.prism.infrastructure.store;
