package com.swingtrader.analysis.news;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.analysis.sufficiency.EvidenceItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NewsParsingTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    @Nested
    @DisplayName("Event Registry")
    class EventRegistryTests {

        @Test
        @DisplayName("reads title, body, publication time and source; skips untitled articles")
        void parse() throws JsonProcessingException {
            List<EvidenceItem> items = EventRegistryNewsTool.parse(json("""
                {"articles": {"results": [
                  {"title": "Reliance posts record profit", "body": "Quarterly numbers beat estimates",
                   "dateTimePub": "2024-06-03T09:15:00Z", "source": {"title": "Mint"}},
                  {"title": "", "body": "no headline"}
                ]}}
                """));

            assertEquals(1, items.size());
            EvidenceItem item = items.get(0);
            assertEquals("Reliance posts record profit", item.title());
            assertEquals("Mint", item.publisher());
            assertEquals(Instant.parse("2024-06-03T09:15:00Z"), item.publishedAt());
        }

        @Test
        @DisplayName("missing payload yields nothing")
        void empty() throws JsonProcessingException {
            assertTrue(EventRegistryNewsTool.parse(null).isEmpty());
            assertTrue(EventRegistryNewsTool.parse(json("{}")).isEmpty());
        }
    }

    @Nested
    @DisplayName("GNews")
    class GNewsTests {

        @Test
        @DisplayName("falls back to GNews as publisher")
        void publisherFallback() throws JsonProcessingException {
            List<EvidenceItem> items = GNewsTool.parse(json("""
                {"articles": [
                  {"title": "TCS wins large deal", "publishedAt": "2024-06-03T10:00:00"},
                  {"title": "Infosys guidance cut", "source": {"name": "Reuters"}, "publishedAt": "not a date"}
                ]}
                """));

            assertEquals(2, items.size());
            assertEquals("GNews", items.get(0).publisher());
            assertEquals(Instant.parse("2024-06-03T10:00:00Z"), items.get(0).publishedAt());
            assertEquals("Reuters", items.get(1).publisher());
            assertNull(items.get(1).publishedAt());
        }
    }

    @Nested
    @DisplayName("Reddit")
    class RedditTests {

        @Test
        @DisplayName("drops posts older than the window")
        void window() throws JsonProcessingException {
            Instant now = Instant.parse("2024-06-10T00:00:00Z");
            long recent = now.minusSeconds(3_600).getEpochSecond();
            long old = now.minusSeconds(10 * 86_400).getEpochSecond();
            List<EvidenceItem> items = RedditMentionsTool.parse(json("""
                {"data": {"children": [
                  {"data": {"title": "HDFC Bank looks cheap here", "created_utc": %d}},
                  {"data": {"title": "Old thread", "created_utc": %d}}
                ]}}
                """.formatted(recent, old)), "IndianStockMarket", 2, now);

            assertEquals(1, items.size());
            assertEquals("reddit/r/IndianStockMarket", items.get(0).publisher());
        }
    }
}
