package com.swingtrader.analysis.tool;

import com.swingtrader.analysis.sufficiency.EvidenceItem;

import java.util.List;
import java.util.Map;

/**
 * The executable behind a registered tool. Receives arguments already validated and
 * completed with defaults by the {@link ToolRegistry}.
 */
@FunctionalInterface
public interface DataFetchStrategy {

    List<EvidenceItem> fetch(Map<String, Object> args);
}
