/**
 * Detector adapters. {@link ca.gc.cra.prism.infrastructure.detect.FileSignatureDetector} classifies
 * media by container signature.
 */
package ca.gc.cra.prism.infrastructure.detect;
