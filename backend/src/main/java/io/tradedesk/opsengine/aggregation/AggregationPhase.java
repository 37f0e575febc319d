package io.tradedesk.opsengine.aggregation;

/** Phases a view computation passes through; logged for tracing slow or degraded requests. */
public enum AggregationPhase {
  PARTIAL,
  NORMALIZING,
  RANKING,
  DONE
}
