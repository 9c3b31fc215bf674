package ca.gc.cra.prism.infrastructure.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemModelLocatorTest {
  @TempDir Path modelDir;

  @Test
  void exactNameWinsOverExtensions() throws IOException {
    Path bundle = Files.createDirectory(modelDir.resolve("deepfake_detector"));
    Files.writeString(modelDir.resolve("deepfake_detector.onnx"), "weights");

    assertEquals(bundle, new FileSystemModelLocator(modelDir).resolve("deepfake_detector"));
  }

  @Test
  void fallsBackToKnownArtifactExtensions() throws IOException {
    Path weights = Files.writeString(modelDir.resolve("face_swap.pt"), "weights");

    assertEquals(weights, new FileSystemModelLocator(modelDir).resolve("face_swap"));
  }

  @Test
  void missingModelOrDirectoryIsReported() {
    FileSystemModelLocator locator = new FileSystemModelLocator(modelDir);
    assertThrows(NoSuchFileException.class, () -> locator.resolve("absent"));

    FileSystemModelLocator nowhere = new FileSystemModelLocator(modelDir.resolve("missing"));
    assertThrows(NoSuchFileException.class, () -> nowhere.resolve("deepfake_detector"));
  }

  @Test
  void pathTraversalIsRejected() {
    FileSystemModelLocator locator = new FileSystemModelLocator(modelDir);

    assertThrows(IOException.class, () -> locator.resolve("../etc/passwd"));
    assertThrows(IOException.class, () -> locator.resolve("a..b"));
    assertThrows(IOException.class, () -> locator.resolve(null));
  }
}
