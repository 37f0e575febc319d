package io.tradedesk.opsengine.aggregation;

import io.tradedesk.opsengine.exception.ServiceUnavailableException;
import java.util.List;
import java.util.Set;

/**
 * Outcome of a fan-out after every source call settled. Failed sources contribute empty record
 * lists; the result is partial when at least one failed.
 */
public final class FanOutResult {

  private final String view;
  private final Set<SourceHandle<?>> handles;
  private final List<String> failedSources;
  private final int sourceCount;
  private final long elapsedMillis;

  FanOutResult(
      String view,
      Set<SourceHandle<?>> handles,
      List<String> failedSources,
      long elapsedMillis) {
    this.view = view;
    this.handles = handles;
    this.failedSources = List.copyOf(failedSources);
    this.sourceCount = handles.size();
    this.elapsedMillis = elapsedMillis;
  }

  /** Rows returned by the source behind {@code handle}; empty when that source failed. */
  public <T> List<T> records(SourceHandle<T> handle) {
    if (!handles.contains(handle)) {
      throw new IllegalArgumentException(
          "Source " + handle.source() + " was not submitted to this fan-out");
    }
    return handle.outcome().join().records();
  }

  /** Whether the source behind {@code handle} threw or timed out. */
  public boolean failed(SourceHandle<?> handle) {
    if (!handles.contains(handle)) {
      throw new IllegalArgumentException(
          "Source " + handle.source() + " was not submitted to this fan-out");
    }
    return handle.outcome().join().failed();
  }

  public boolean isPartial() {
    return !failedSources.isEmpty();
  }

  public boolean isTotalFailure() {
    return sourceCount > 0 && failedSources.size() == sourceCount;
  }

  /**
   * Fails the request when no source answered: with every source down the shared store is treated
   * as unavailable.
   *
   * @throws ServiceUnavailableException if every source failed
   */
  public FanOutResult requireAvailable() {
    if (isTotalFailure()) {
      throw new ServiceUnavailableException(
          "Service unavailable", "Data is temporarily unavailable");
    }
    return this;
  }

  public AggregationPhase phase() {
    return isPartial() ? AggregationPhase.PARTIAL : AggregationPhase.NORMALIZING;
  }

  public List<String> failedSources() {
    return failedSources;
  }

  public int sourceCount() {
    return sourceCount;
  }

  public long elapsedMillis() {
    return elapsedMillis;
  }

  public String view() {
    return view;
  }
}
