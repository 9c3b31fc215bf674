package ca.gc.cra.prism.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Resolves a logical model name to a loadable location.
 *
 * <p>The scheduler calls this once during start-up; failures abort the start.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ModelLocatorPort {
  /**
   * Resolves the model location.
   *
   * @param modelName logical model name such as {@code deepfake_detector}
   * @return path to the model artifact
   * @throws IOException if the model cannot be located
   */
  Path resolve(String modelName) throws IOException;
}
