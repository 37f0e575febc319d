package io.tradedesk.opsengine.aggregation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs the source calls of one view computation concurrently and joins them behind a single
 * barrier. Each call carries its own timeout; a call that throws or times out settles as an empty
 * result and is logged, so one slow or broken source never fails the request.
 */
@Component
public class SourceFanOut {

  private static final Logger log = LoggerFactory.getLogger(SourceFanOut.class);

  private final Executor executor;
  private final SourceProperties properties;

  public SourceFanOut(
      @Qualifier(FanOutConfig.EXECUTOR_BEAN) Executor executor, SourceProperties properties) {
    this.executor = executor;
    this.properties = properties;
  }

  /** Starts collecting source calls for one computation of {@code view} for {@code tenantId}. */
  public FanOut begin(String view, String tenantId) {
    return new FanOut(view, tenantId);
  }

  public int rowCap() {
    return properties.rowCap();
  }

  public int countingRowCap() {
    return properties.countingRowCap();
  }

  /** Source calls submitted for one computation. Not thread-safe; owned by the request thread. */
  public final class FanOut {

    private final String view;
    private final String tenantId;
    private final long startedAt = System.nanoTime();
    private final List<SourceHandle<?>> handles = new ArrayList<>();

    private FanOut(String view, String tenantId) {
      this.view = view;
      this.tenantId = tenantId;
    }

    /** Submits {@code call} immediately; its rows are read back through the returned handle. */
    public <T> SourceHandle<T> submit(String source, Supplier<List<T>> call) {
      CompletableFuture<SourceOutcome<T>> outcome;
      try {
        outcome =
            CompletableFuture.supplyAsync(call, executor)
                .orTimeout(properties.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle(
                    (rows, ex) ->
                        ex == null ? SourceOutcome.ok(source, rows) : settleFailure(source, ex));
      } catch (RejectedExecutionException e) {
        outcome = CompletableFuture.completedFuture(settleFailure(source, e));
      }
      var handle = new SourceHandle<>(source, outcome);
      handles.add(handle);
      return handle;
    }

    /** Join barrier: waits for every submitted call to settle. Never throws for source failures. */
    public FanOutResult awaitAll() {
      CompletableFuture.allOf(
              handles.stream().map(SourceHandle::outcome).toArray(CompletableFuture[]::new))
          .join();

      List<String> failed = new ArrayList<>();
      for (SourceHandle<?> handle : handles) {
        if (handle.outcome().join().failed()) {
          failed.add(handle.source());
        }
      }
      Set<SourceHandle<?>> submitted = Collections.newSetFromMap(new IdentityHashMap<>());
      submitted.addAll(handles);

      long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
      var result = new FanOutResult(view, submitted, failed, elapsedMillis);
      log.debug(
          "Fan-out settled: view={}, tenant={}, phase={}, sources={}, failed={}, ms={}",
          view,
          tenantId,
          result.phase(),
          handles.size(),
          failed,
          elapsedMillis);
      return result;
    }

    private <T> SourceOutcome<T> settleFailure(String source, Throwable ex) {
      Throwable cause = ex instanceof CompletionException && ex.getCause() != null
          ? ex.getCause()
          : ex;
      if (cause instanceof TimeoutException) {
        log.warn(
            "Source timed out: view={}, source={}, tenant={}, timeoutMs={}",
            view,
            source,
            tenantId,
            properties.timeout().toMillis());
      } else {
        log.warn(
            "Source failed: view={}, source={}, tenant={}, reason={}",
            view,
            source,
            tenantId,
            cause.toString(),
            cause);
      }
      return SourceOutcome.failed(source);
    }
  }
}
