package ca.gc.cra.prism.infrastructure.model;

import ca.gc.cra.prism.application.port.ModelLocatorPort;
import ca.gc.cra.prism.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Resolves model names against a base directory.
 *
 * <p>A model named {@code deepfake_detector} is found as {@code <base>/deepfake_detector} (file or
 * directory) or, failing that, as the same name with one of the known artifact extensions.</p>
 *
 * @since 0.1.0
 */
public final class FileSystemModelLocator implements ModelLocatorPort {
  static final List<String> ARTIFACT_EXTENSIONS = List.of(".onnx", ".pt", ".pth", ".bin", ".model");

  private final Path baseDirectory;

  /**
   * Creates a locator rooted at {@code baseDirectory}.
   *
   * @param baseDirectory directory holding model artifacts
   */
  public FileSystemModelLocator(Path baseDirectory) {
    this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
  }

  @Override
  public Path resolve(String modelName) throws IOException {
    String name;
    try {
      name = Strings.requireIdentifier("modelName", modelName);
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new IOException("Invalid model name: " + modelName, ex);
    }
    if (!Files.isDirectory(baseDirectory)) {
      throw new NoSuchFileException(baseDirectory.toString(), null, "model directory does not exist");
    }
    Path exact = baseDirectory.resolve(name);
    if (Files.exists(exact)) {
      return exact;
    }
    for (String extension : ARTIFACT_EXTENSIONS) {
      Path candidate = baseDirectory.resolve(name + extension);
      if (Files.isRegularFile(candidate)) {
        return candidate;
      }
    }
    throw new NoSuchFileException(exact.toString(), null, "model '" + name + "' not found");
  }

  /**
   * Base directory searched by this locator.
   *
   * @return absolute base directory
   */
  public Path baseDirectory() {
    return baseDirectory;
  }
}
