/**
 * Application layer: ports and the scheduling use case that ties detectors to priority queues.
 */
package ca.gc.cra.prism.application;
