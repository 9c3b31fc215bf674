package ca.gc.cra.prism.infrastructure.store;

import ca.gc.cra.prism.application.port.ResultStore;
import ca.gc.cra.prism.domain.analysis.JobRecord;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Process-local {@link ResultStore} backed by a {@link ConcurrentHashMap}.
 * <p><strong>Why:</strong> Records live for the process lifetime (bounded by cleanup); no persistence is
 * required.</p>
 * <p><strong>Thread-safety:</strong> Each update runs inside {@link ConcurrentHashMap#computeIfPresent},
 * so transitions on one key are serialized and readers only ever see whole immutable snapshots.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryResultStore implements ResultStore {
  private final ConcurrentMap<String, JobRecord> records = new ConcurrentHashMap<>();

  @Override
  public boolean create(JobRecord record) {
    Objects.requireNonNull(record, "record");
    return records.putIfAbsent(record.analysisId(), record) == null;
  }

  @Override
  public Optional<JobRecord> get(String analysisId) {
    if (analysisId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(records.get(analysisId));
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalStateException propagated from {@code transition}; the record is left unchanged
   */
  @Override
  public Optional<JobRecord> update(String analysisId, UnaryOperator<JobRecord> transition) {
    Objects.requireNonNull(analysisId, "analysisId");
    Objects.requireNonNull(transition, "transition");
    JobRecord updated = records.computeIfPresent(analysisId, (id, current) -> {
      JobRecord next = Objects.requireNonNull(transition.apply(current), "transition result");
      if (!next.analysisId().equals(id)) {
        throw new IllegalStateException("transition changed analysis id " + id + " -> " + next.analysisId());
      }
      return next;
    });
    return Optional.ofNullable(updated);
  }

  @Override
  public boolean remove(String analysisId) {
    return analysisId != null && records.remove(analysisId) != null;
  }

  @Override
  public int removeIf(Predicate<JobRecord> filter) {
    Objects.requireNonNull(filter, "filter");
    int removed = 0;
    for (var entry : records.entrySet()) {
      // Conditional remove keeps a concurrently updated record if it no longer matches.
      JobRecord current = entry.getValue();
      if (filter.test(current) && records.remove(entry.getKey(), current)) {
        removed++;
      }
    }
    return removed;
  }

  @Override
  public Collection<JobRecord> snapshot() {
    return List.copyOf(records.values());
  }

  @Override
  public int size() {
    return records.size();
  }
}
