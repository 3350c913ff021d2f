package com.swingtrader.analysis.sufficiency;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * One piece of collected evidence (a news article or a social post).
 *
 * @param sourceTool name of the tool that produced it
 */
public record EvidenceItem(
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("published_at") Instant publishedAt,
    @JsonProperty("publisher") String publisher,
    @JsonProperty("source_tool") String sourceTool
) {
    /**
     * Dedup key: titles differing only in case or surrounding whitespace are the same item.
     * An untitled item is keyed by its description, and one with neither has no key and is
     * never treated as a duplicate.
     */
    @JsonIgnore
    public String normalizedTitle() {
        String text = title == null || title.isBlank() ? description : title;
        return text == null || text.isBlank() ? null : text.strip().toLowerCase(Locale.ROOT);
    }

    public EvidenceItem withSourceTool(String tool) {
        return new EvidenceItem(title, description, publishedAt, publisher, tool);
    }
}
