package com.swingtrader.orchestrator.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code swing-trader.*} in application.yml. API keys and endpoints are
 * not here; they are read with {@code @Value} where the clients are built.
 */
@Data
@NoArgsConstructor
@ConfigurationProperties(prefix = "swing-trader")
public class SwingTraderProperties {

    private Duration cacheTtl = Duration.ofHours(3);

    private Duration unitTimeout = Duration.ofMinutes(5);

    private int historyCapacity = 100;

    private boolean runOnStartup = false;

    /** Initial input for the startup run, e.g. {@code top_n: 10}. */
    private Map<String, Object> startupInput = new LinkedHashMap<>();

    private Graph graph = new Graph();

    private Sufficiency sufficiency = new Sufficiency();

    private Strategist strategist = new Strategist();

    /** Symbols screened by the scouting unit. */
    private List<Listing> universe = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class Graph {
        private String name = "swing-trading";
        private String description = "";
        private List<Node> nodes = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class Node {
        private String id;
        private String type;
        private Map<String, Object> config = new LinkedHashMap<>();
        private Map<String, String> inputMapping = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    public static class Sufficiency {
        private int minItems = 5;
        private List<Integer> escalationLadderDays = new ArrayList<>(List.of(2, 90, 180));
        private int maxResults = 50;
        private int minDistinctSources = 1;
        private int minCoverageDays = 0;
        private int maxRounds = 0;
    }

    @Data
    @NoArgsConstructor
    public static class Strategist {
        private double minConfidence = 0.75;
        private double maxPositionValue = 10_000;
        private boolean paperTrading = true;
    }

    @Data
    @NoArgsConstructor
    public static class Listing {
        private String symbol;
        private String name;
    }
}
