package com.swingtrader.orchestrator.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.swingtrader.common.unit.ErrorKind;
import com.swingtrader.common.unit.UnitOutcome;
import com.swingtrader.common.unit.UnitStatus;
import com.swingtrader.orchestrator.graph.UnitNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * What happened to one unit during a run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnitRecord(
    @JsonProperty("unit_id") String unitId,
    @JsonProperty("type") String type,
    @JsonProperty("status") UnitStatus status,
    @JsonProperty("output") Map<String, Object> output,
    @JsonProperty("error_kind") ErrorKind errorKind,
    @JsonProperty("error") String error,
    @JsonProperty("cache_hit") boolean cacheHit,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("duration_ms") long durationMs
) {
    public static UnitRecord of(UnitNode node, UnitOutcome outcome, Instant startedAt, Instant completedAt) {
        return new UnitRecord(node.id(), node.type(), outcome.status(), outcome.output(), outcome.errorKind(),
            outcome.message(), outcome.cacheHit(), startedAt, completedAt,
            Duration.between(startedAt, completedAt).toMillis());
    }

    @JsonIgnore
    public boolean succeeded() {
        return status == UnitStatus.SUCCEEDED;
    }
}
