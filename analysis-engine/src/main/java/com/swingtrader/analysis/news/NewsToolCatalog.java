package com.swingtrader.analysis.news;

import com.swingtrader.analysis.tool.ParameterType;
import com.swingtrader.analysis.tool.SourceTier;
import com.swingtrader.analysis.tool.ToolDescriptor;
import com.swingtrader.analysis.tool.ToolParameter;
import com.swingtrader.analysis.tool.ToolRegistry;

import java.util.List;

/**
 * Registers the sentiment data sources under their tool names.
 */
public final class NewsToolCatalog {

    public static final String FETCH_NEWS    = "fetch_news";
    public static final String FETCH_GNEWS   = "fetch_gnews";
    public static final String FETCH_REDDIT  = "fetch_reddit_mentions";
    public static final String FETCH_TWITTER = "fetch_twitter_mentions";

    /** Shared by every news and social tool. */
    public static final List<ToolParameter> COMMON_PARAMETERS = List.of(
        ToolParameter.required("symbol", ParameterType.STRING, "Stock symbol"),
        ToolParameter.required("company_name", ParameterType.STRING, "Company name"),
        ToolParameter.optional("days", ParameterType.INTEGER, 2, "Number of days to look back"),
        ToolParameter.optional("max_results", ParameterType.INTEGER, 50, "Maximum results")
    );

    private NewsToolCatalog() {}

    public static ToolRegistry register(ToolRegistry registry,
                                        EventRegistryNewsTool news,
                                        GNewsTool gnews,
                                        RedditMentionsTool reddit) {
        registry.register(new ToolDescriptor(FETCH_NEWS,
            "Mainstream financial news from the primary provider. Preferred expansion path.",
            SourceTier.PRIMARY, COMMON_PARAMETERS, true, news));
        registry.register(new ToolDescriptor(FETCH_GNEWS,
            "Google News aggregated sources. Use when the primary provider has low volume.",
            SourceTier.ALTERNATE, COMMON_PARAMETERS, true, gnews));
        registry.register(new ToolDescriptor(FETCH_REDDIT,
            "Retail investor discussion from r/stocks, r/investing and similar. Never a sole source.",
            SourceTier.SUPPLEMENTARY, COMMON_PARAMETERS, true, reddit));
        // no Twitter/X API access yet; declared so it shows up in listings
        registry.register(new ToolDescriptor(FETCH_TWITTER,
            "Twitter/X mentions. Not implemented.",
            SourceTier.SUPPLEMENTARY, COMMON_PARAMETERS, false,
            args -> { throw new UnsupportedOperationException("Twitter integration is not available"); }));
        return registry;
    }
}
