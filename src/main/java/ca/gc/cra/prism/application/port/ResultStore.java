package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.analysis.JobRecord;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Keyed store of job records shared by dispatcher threads and callers.
 * <p><strong>Why:</strong> Decouples lifecycle tracking from the storage mechanism.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reserve ids on creation so two submissions never share a record.</li>
 *   <li>Apply transitions atomically per key; readers see whole snapshots only.</li>
 *   <li>Remove records only through {@link #remove} and {@link #removeIf}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use from every worker and
 * caller thread.</p>
 *
 * @since 0.1.0
 */
public interface ResultStore {
  /**
   * Inserts a new record unless its id is already present.
   *
   * @param record record to insert
   * @return {@code true} if inserted, {@code false} when the id is taken
   */
  boolean create(JobRecord record);

  /**
   * Looks up a record.
   *
   * @param analysisId job identifier
   * @return current snapshot, or empty when unknown or cleaned up
   */
  Optional<JobRecord> get(String analysisId);

  /**
   * Atomically replaces a record with the result of {@code transition}.
   *
   * @param analysisId job identifier
   * @param transition function producing the next snapshot; may throw {@link IllegalStateException}
   *     to reject the transition, leaving the record unchanged
   * @return updated snapshot, or empty when the id is unknown
   */
  Optional<JobRecord> update(String analysisId, UnaryOperator<JobRecord> transition);

  /**
   * Removes a record.
   *
   * @param analysisId job identifier
   * @return {@code true} if a record was removed
   */
  boolean remove(String analysisId);

  /**
   * Removes every record matching {@code filter}.
   *
   * @param filter removal predicate evaluated against each current snapshot
   * @return number of removed records
   */
  int removeIf(Predicate<JobRecord> filter);

  /**
   * Returns a point-in-time copy of all records.
   *
   * @return snapshot collection; not backed by the store
   */
  Collection<JobRecord> snapshot();

  /**
   * Returns the number of stored records.
   *
   * @return record count
   */
  int size();
}
