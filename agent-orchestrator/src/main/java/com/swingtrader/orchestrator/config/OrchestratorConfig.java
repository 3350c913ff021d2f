package com.swingtrader.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.swingtrader.analysis.agent.scouting.ScoutingUnit;
import com.swingtrader.analysis.agent.sentiment.SentimentAnalyzer;
import com.swingtrader.analysis.agent.sentiment.SentimentUnit;
import com.swingtrader.analysis.agent.strategist.DecisionMaker;
import com.swingtrader.analysis.agent.strategist.StrategistUnit;
import com.swingtrader.analysis.agent.technical.TechnicalUnit;
import com.swingtrader.analysis.market.AlphaVantageStockDataProvider;
import com.swingtrader.analysis.market.StockDataProvider;
import com.swingtrader.analysis.market.StockListing;
import com.swingtrader.analysis.news.EventRegistryNewsTool;
import com.swingtrader.analysis.news.GNewsTool;
import com.swingtrader.analysis.news.NewsToolCatalog;
import com.swingtrader.analysis.news.RedditMentionsTool;
import com.swingtrader.analysis.reasoning.AnthropicReasoningClient;
import com.swingtrader.analysis.reasoning.ReasoningClient;
import com.swingtrader.analysis.sufficiency.AdaptiveSufficiencyLoop;
import com.swingtrader.analysis.sufficiency.ReasoningSufficiencyEvaluator;
import com.swingtrader.analysis.sufficiency.SufficiencyPolicy;
import com.swingtrader.analysis.tool.ToolRegistry;
import com.swingtrader.analysis.trade.PaperTradeExecutor;
import com.swingtrader.analysis.trade.TradeExecutor;
import com.swingtrader.common.cache.InMemoryResultCache;
import com.swingtrader.common.cache.ResultCache;
import com.swingtrader.common.json.StructuredResponseParser;
import com.swingtrader.orchestrator.engine.DagExecutionEngine;
import com.swingtrader.orchestrator.engine.UnitRegistry;
import com.swingtrader.orchestrator.graph.GraphDefinition;
import com.swingtrader.orchestrator.graph.UnitNode;
import com.swingtrader.orchestrator.history.ExecutionHistory;
import com.swingtrader.orchestrator.logger.ExecutionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Process-scoped state and collaborators: one cache, one tool registry, one unit
 * registry, one engine and one history, all created here and passed by reference.
 */
@Configuration
@EnableConfigurationProperties(SwingTraderProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    static final String MIN_CONFIDENCE_KEY = "min_confidence_threshold";

    @Value("${alpha-vantage.api-key:}")
    private String alphaVantageApiKey;

    @Value("${event-registry.api-key:}")
    private String eventRegistryApiKey;

    @Value("${gnews.api-key:}")
    private String gnewsApiKey;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.model:claude-3-5-sonnet-latest}")
    private String anthropicModel;

    @Value("${anthropic.max-tokens:2048}")
    private int anthropicMaxTokens;

    @Value("${services.request-timeout:30s}")
    private Duration requestTimeout;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResultCache resultCache(SwingTraderProperties properties, Clock clock) {
        return new InMemoryResultCache(properties.getCacheTtl(), clock);
    }

    @Bean
    public StructuredResponseParser structuredResponseParser(ObjectMapper objectMapper) {
        return new StructuredResponseParser(objectMapper);
    }

    @Bean
    public ReasoningClient reasoningClient(@Qualifier("anthropicWebClient") WebClient anthropicWebClient,
                                           ObjectMapper objectMapper) {
        AnthropicReasoningClient client = new AnthropicReasoningClient(anthropicWebClient, objectMapper,
            anthropicApiKey, anthropicModel, anthropicMaxTokens, requestTimeout);
        if (!client.isConfigured()) {
            log.warn("anthropic.api-key not set; sufficiency, sentiment and decisions use rule-based fallbacks");
        }
        return client;
    }

    @Bean
    public StockDataProvider stockDataProvider(@Qualifier("marketDataWebClient") WebClient marketDataWebClient) {
        if (alphaVantageApiKey == null || alphaVantageApiKey.isBlank()) {
            log.warn("alpha-vantage.api-key not set; market data requests will fail and affected stocks are skipped");
        }
        return new AlphaVantageStockDataProvider(marketDataWebClient, alphaVantageApiKey, requestTimeout);
    }

    @Bean
    public ToolRegistry toolRegistry(@Qualifier("eventRegistryWebClient") WebClient eventRegistryWebClient,
                                     @Qualifier("gnewsWebClient") WebClient gnewsWebClient,
                                     @Qualifier("redditWebClient") WebClient redditWebClient,
                                     Clock clock) {
        return NewsToolCatalog.register(new ToolRegistry(),
            new EventRegistryNewsTool(eventRegistryWebClient, eventRegistryApiKey, requestTimeout, clock),
            new GNewsTool(gnewsWebClient, gnewsApiKey, requestTimeout, clock),
            new RedditMentionsTool(redditWebClient, requestTimeout, clock));
    }

    @Bean
    public SufficiencyPolicy sufficiencyPolicy(SwingTraderProperties properties) {
        SwingTraderProperties.Sufficiency s = properties.getSufficiency();
        return new SufficiencyPolicy(s.getMinItems(), s.getEscalationLadderDays(), s.getMaxResults(),
            s.getMinDistinctSources(), s.getMinCoverageDays(), s.getMaxRounds());
    }

    @Bean
    public AdaptiveSufficiencyLoop adaptiveSufficiencyLoop(ToolRegistry toolRegistry,
                                                           ReasoningClient reasoningClient,
                                                           StructuredResponseParser parser,
                                                           SufficiencyPolicy policy,
                                                           ResultCache resultCache) {
        return new AdaptiveSufficiencyLoop(toolRegistry,
            new ReasoningSufficiencyEvaluator(reasoningClient, parser), policy, resultCache);
    }

    @Bean
    public TradeExecutor tradeExecutor(SwingTraderProperties properties) {
        if (!properties.getStrategist().isPaperTrading()) {
            log.warn("swing-trader.strategist.paper-trading=false but no broker integration exists; orders stay simulated");
        }
        return new PaperTradeExecutor();
    }

    @Bean
    public ExecutionFlowLogger executionFlowLogger() {
        return new ExecutionFlowLogger();
    }

    @Bean
    public UnitRegistry unitRegistry(SwingTraderProperties properties,
                                     StockDataProvider stockDataProvider,
                                     AdaptiveSufficiencyLoop collectionLoop,
                                     ReasoningClient reasoningClient,
                                     StructuredResponseParser parser,
                                     TradeExecutor tradeExecutor,
                                     ResultCache resultCache,
                                     ObjectMapper objectMapper) {
        List<StockListing> universe = properties.getUniverse().stream()
            .map(l -> new StockListing(l.getSymbol(), l.getName()))
            .toList();
        if (universe.isEmpty()) {
            log.warn("swing-trader.universe is empty; scouting will shortlist nothing");
        }
        SentimentAnalyzer sentimentAnalyzer = new SentimentAnalyzer(reasoningClient, parser);
        SwingTraderProperties.Strategist strategist = properties.getStrategist();

        return new UnitRegistry()
            .register(ScoutingUnit.TYPE,
                (id, config) -> new ScoutingUnit(id, stockDataProvider, universe, objectMapper))
            .register(TechnicalUnit.TYPE,
                (id, config) -> new TechnicalUnit(id, stockDataProvider, objectMapper))
            .register(SentimentUnit.TYPE,
                (id, config) -> new SentimentUnit(id, collectionLoop, sentimentAnalyzer, resultCache, objectMapper))
            .register(StrategistUnit.TYPE, (id, config) -> {
                double minConfidence = minConfidence(config, strategist.getMinConfidence());
                DecisionMaker decisionMaker = new DecisionMaker(reasoningClient, parser, objectMapper,
                    minConfidence, strategist.getMaxPositionValue());
                return new StrategistUnit(id, decisionMaker, tradeExecutor, minConfidence, objectMapper);
            });
    }

    @Bean
    public GraphDefinition graphDefinition(SwingTraderProperties properties) {
        SwingTraderProperties.Graph graph = properties.getGraph();
        List<UnitNode> nodes = graph.getNodes().stream()
            .map(n -> new UnitNode(n.getId(), n.getType(), n.getConfig(), n.getInputMapping()))
            .toList();
        return new GraphDefinition(graph.getName(), graph.getDescription(), nodes);
    }

    @Bean
    public DagExecutionEngine dagExecutionEngine(UnitRegistry unitRegistry, ResultCache resultCache,
                                                 SwingTraderProperties properties,
                                                 ExecutionFlowLogger flowLogger, Clock clock) {
        return new DagExecutionEngine(unitRegistry, resultCache, properties.getUnitTimeout(), flowLogger, clock);
    }

    @Bean
    public ExecutionHistory executionHistory(SwingTraderProperties properties) {
        return new ExecutionHistory(properties.getHistoryCapacity());
    }

    static double minConfidence(Map<String, Object> config, double fallback) {
        Object value = config == null ? null : config.get(MIN_CONFIDENCE_KEY);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {}={}, using {}", MIN_CONFIDENCE_KEY, s, fallback);
            }
        }
        return fallback;
    }
}
