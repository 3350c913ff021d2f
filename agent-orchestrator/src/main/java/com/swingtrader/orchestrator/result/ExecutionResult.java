package com.swingtrader.orchestrator.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete record of one workflow run. Always produced, whatever failed.
 *
 * @param units            per-unit records in execution order
 * @param aggregatedOutput outputs of successful units keyed by unit id; failed and skipped
 *                         units contribute {@code {status, error}}
 * @param error            set only when the graph itself was rejected
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("graph") String graphName,
    @JsonProperty("status") OverallStatus status,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("execution_order") List<String> executionOrder,
    @JsonProperty("waves") List<List<String>> waves,
    @JsonProperty("units") Map<String, UnitRecord> units,
    @JsonProperty("aggregated_output") Map<String, Object> aggregatedOutput,
    @JsonProperty("error") String error
) {
    public static ExecutionResult of(String executionId, String graphName, Instant startedAt, Instant completedAt,
                                     List<String> order, List<List<String>> waves, List<UnitRecord> records) {
        Map<String, UnitRecord> units = new LinkedHashMap<>();
        Map<String, Object> aggregated = new LinkedHashMap<>();
        for (UnitRecord record : records) {
            units.put(record.unitId(), record);
            if (record.succeeded()) {
                aggregated.put(record.unitId(), record.output());
            } else {
                Map<String, Object> failure = new LinkedHashMap<>();
                failure.put("status", record.status());
                failure.put("error", record.error());
                aggregated.put(record.unitId(), failure);
            }
        }
        return new ExecutionResult(executionId, graphName, overall(records), startedAt, completedAt,
            order, waves, units, aggregated, null);
    }

    /** A run whose graph failed resolution: nothing executed. */
    public static ExecutionResult rejected(String executionId, String graphName, Instant startedAt,
                                           Instant completedAt, String error) {
        return new ExecutionResult(executionId, graphName, OverallStatus.FAILURE, startedAt, completedAt,
            List.of(), List.of(), Map.of(), Map.of(), error);
    }

    static OverallStatus overall(List<UnitRecord> records) {
        long succeeded = records.stream().filter(UnitRecord::succeeded).count();
        if (succeeded == records.size()) return OverallStatus.SUCCESS;
        return succeeded == 0 ? OverallStatus.FAILURE : OverallStatus.PARTIAL;
    }

    public UnitRecord unit(String unitId) {
        return units.get(unitId);
    }
}
