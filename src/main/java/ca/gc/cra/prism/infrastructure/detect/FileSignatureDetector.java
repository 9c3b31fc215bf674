package ca.gc.cra.prism.infrastructure.detect;

import ca.gc.cra.prism.application.port.DetectorPort;
import ca.gc.cra.prism.domain.analysis.AnalysisException;
import ca.gc.cra.prism.domain.analysis.DetectionResult;
import ca.gc.cra.prism.domain.analysis.FileKind;
import ca.gc.cra.prism.domain.analysis.FrameFinding;
import ca.gc.cra.prism.domain.analysis.Verdict;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Deterministic detector that checks a file's container signature against its
 * declared kind.
 * <p><strong>Why:</strong> Gives the scheduler a real, dependency-free capability to run end to end; a
 * file whose bytes contradict its declared kind is the simplest manipulation signal.</p>
 * <p><strong>Verdicts:</strong>
 * <ul>
 *   <li>Container matches the declared kind: {@link Verdict#AUTHENTIC}.</li>
 *   <li>Container belongs to another kind: {@link Verdict#MANIPULATED} with an anomaly.</li>
 *   <li>Container not recognized: {@link Verdict#INCONCLUSIVE} with an anomaly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent {@link #analyze} calls.</p>
 *
 * @since 0.1.0
 */
public final class FileSignatureDetector implements DetectorPort {
  private static final Logger log = LoggerFactory.getLogger(FileSignatureDetector.class);
  private static final double MATCH_CONFIDENCE = 0.75d;
  private static final double MISMATCH_CONFIDENCE = 0.9d;
  private static final double UNKNOWN_CONFIDENCE = 0.5d;

  private final Path modelPath;
  private final Set<FileKind> supported;

  /**
   * Creates a detector bound to a resolved model location.
   *
   * @param modelPath model artifact, recorded in diagnostics
   * @param supported kinds this detector accepts
   */
  public FileSignatureDetector(Path modelPath, Set<FileKind> supported) {
    this.modelPath = Objects.requireNonNull(modelPath, "modelPath");
    Objects.requireNonNull(supported, "supported");
    this.supported = copyOf(supported);
  }

  /**
   * Factory that requires the model path to exist and enables every kind.
   *
   * @return detector factory
   */
  public static DetectorPort.Factory factory() {
    return factory(EnumSet.allOf(FileKind.class));
  }

  /**
   * Factory that requires the model path to exist.
   *
   * @param supported kinds the opened detector accepts
   * @return detector factory
   */
  public static DetectorPort.Factory factory(Set<FileKind> supported) {
    Set<FileKind> kinds = copyOf(Objects.requireNonNull(supported, "supported"));
    return modelPath -> {
      if (modelPath == null || !Files.exists(modelPath)) {
        throw new AnalysisException("Model not found: " + modelPath);
      }
      log.info("Signature detector ready (model={}, kinds={})", modelPath, kinds);
      return new FileSignatureDetector(modelPath, kinds);
    };
  }

  @Override
  public boolean supports(FileKind kind) {
    return kind != null && supported.contains(kind);
  }

  @Override
  public DetectionResult analyze(String fileRef, FileKind kind) throws AnalysisException {
    Path path = toPath(fileRef);
    if (!Files.isRegularFile(path)) {
      throw new AnalysisException("File not found: " + fileRef);
    }
    byte[] header = new byte[ContainerSignature.HEADER_BYTES];
    int length;
    long size;
    try (InputStream in = Files.newInputStream(path)) {
      length = in.readNBytes(header, 0, header.length);
      size = Files.size(path);
    } catch (IOException ex) {
      throw new AnalysisException("Unable to read " + fileRef, ex);
    }
    if (length == 0) {
      throw new AnalysisException("File is empty: " + fileRef);
    }

    Optional<ContainerSignature> container = ContainerSignature.identify(header, length);
    Map<String, String> diagnostics = new LinkedHashMap<>();
    diagnostics.put("detector", "file-signature");
    Path modelName = modelPath.getFileName();
    diagnostics.put("model", modelName == null ? modelPath.toString() : modelName.toString());
    diagnostics.put("sizeBytes", Long.toString(size));
    diagnostics.put("container", container.map(c -> c.name().toLowerCase(Locale.ROOT)).orElse("unknown"));

    List<String> anomalies = new ArrayList<>();
    Verdict verdict;
    double confidence;
    if (container.isEmpty()) {
      verdict = Verdict.INCONCLUSIVE;
      confidence = UNKNOWN_CONFIDENCE;
      anomalies.add("unrecognized container signature");
    } else if (container.get().kind() != kind) {
      verdict = Verdict.MANIPULATED;
      confidence = MISMATCH_CONFIDENCE;
      anomalies.add("declared " + kind.wireName() + " but container is " + container.get().kind().wireName());
    } else {
      verdict = Verdict.AUTHENTIC;
      confidence = MATCH_CONFIDENCE;
    }

    List<FrameFinding> frames = kind == FileKind.IMAGE
        ? List.of(new FrameFinding(0, verdict == Verdict.AUTHENTIC ? 0d : confidence, 0))
        : List.of();
    return new DetectionResult(verdict, confidence, anomalies, frames, diagnostics);
  }

  private static Set<FileKind> copyOf(Set<FileKind> kinds) {
    return kinds.isEmpty() ? EnumSet.noneOf(FileKind.class) : EnumSet.copyOf(kinds);
  }

  private static Path toPath(String fileRef) throws AnalysisException {
    try {
      return Path.of(fileRef);
    } catch (InvalidPathException ex) {
      throw new AnalysisException("Invalid file reference: " + fileRef, ex);
    }
  }
}
