package ca.gc.cra.prism.infrastructure.json;

import ca.gc.cra.prism.application.scheduler.SchedulerMetrics;
import ca.gc.cra.prism.domain.analysis.DetectionResult;
import ca.gc.cra.prism.domain.analysis.FrameFinding;
import ca.gc.cra.prism.domain.analysis.JobOutcome;
import ca.gc.cra.prism.domain.analysis.JobRecord;
import ca.gc.cra.prism.domain.analysis.Priority;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Renders job records and scheduler metrics as single-line JSON documents.
 *
 * <p>Uses the Jackson streaming API; field order is stable so output can be diffed and grepped.</p>
 *
 * @since 0.1.0
 */
public final class JobRecordJsonWriter {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Serializes a job record.
   *
   * @param record record to render
   * @return compact JSON object
   */
  public String write(JobRecord record) {
    Objects.requireNonNull(record, "record");
    return render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("analysisId", record.analysisId());
      gen.writeStringField("status", record.status().wireName());
      gen.writeStringField("fileRef", record.fileRef());
      gen.writeStringField("fileKind", record.fileKind().wireName());
      gen.writeStringField("priority", record.priority().wireName());
      gen.writeStringField("submitter", record.submitter());
      gen.writeStringField("createdAt", Instant.ofEpochMilli(record.createdAtMillis()).toString());
      gen.writeStringField("updatedAt", Instant.ofEpochMilli(record.updatedAtMillis()).toString());
      if (record.startedAtMillis() != JobRecord.NOT_STARTED) {
        gen.writeStringField("startedAt", Instant.ofEpochMilli(record.startedAtMillis()).toString());
      }
      gen.writeNumberField("processingMillis", record.processingMillis());
      JobOutcome outcome = record.outcome();
      if (outcome instanceof JobOutcome.Success success) {
        gen.writeFieldName("result");
        writeResult(gen, success.result());
      } else if (outcome instanceof JobOutcome.Failure failure) {
        gen.writeObjectFieldStart("error");
        gen.writeStringField("kind", failure.kind().name());
        gen.writeStringField("detail", failure.detail());
        gen.writeEndObject();
      }
      gen.writeEndObject();
    });
  }

  /**
   * Serializes an aggregate metrics snapshot.
   *
   * @param metrics snapshot to render
   * @return compact JSON object
   */
  public String write(SchedulerMetrics metrics) {
    Objects.requireNonNull(metrics, "metrics");
    return render(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("total", metrics.total());
      gen.writeNumberField("queued", metrics.queued());
      gen.writeNumberField("processing", metrics.processing());
      gen.writeNumberField("completed", metrics.completed());
      gen.writeNumberField("failed", metrics.failed());
      gen.writeObjectFieldStart("queueDepths");
      for (Map.Entry<Priority, Integer> depth : metrics.queueDepths().entrySet()) {
        gen.writeNumberField(depth.getKey().wireName(), depth.getValue());
      }
      gen.writeEndObject();
      gen.writeNumberField("avgProcessingMillis", metrics.avgProcessingMillis());
      gen.writeNumberField("successRate", metrics.successPercent());
      gen.writeEndObject();
    });
  }

  private static void writeResult(JsonGenerator gen, DetectionResult result) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("verdict", result.verdict().name());
    gen.writeNumberField("confidence", result.confidence());
    gen.writeNumberField("overallScore", result.overallScore());
    gen.writeArrayFieldStart("anomalies");
    for (String anomaly : result.anomalies()) {
      gen.writeString(anomaly);
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("frames");
    for (FrameFinding frame : result.frameFindings()) {
      gen.writeStartObject();
      gen.writeNumberField("index", frame.index());
      gen.writeNumberField("score", frame.score());
      gen.writeNumberField("facesDetected", frame.facesDetected());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeObjectFieldStart("diagnostics");
    for (Map.Entry<String, String> entry : result.diagnostics().entrySet()) {
      gen.writeStringField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private String render(JsonBody body) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON", ex);
    }
    return out.toString();
  }

  @FunctionalInterface
  private interface JsonBody {
    void write(JsonGenerator gen) throws IOException;
  }
}
