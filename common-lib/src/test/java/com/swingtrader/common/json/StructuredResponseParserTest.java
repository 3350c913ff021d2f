package com.swingtrader.common.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StructuredResponseParserTest {

    private final StructuredResponseParser parser = new StructuredResponseParser(new ObjectMapper());

    @Test
    @DisplayName("bare JSON object")
    void bareObject() {
        Optional<JsonNode> node = parser.parseObject("{\"sufficient\": true}");
        assertTrue(node.isPresent());
        assertTrue(node.get().path("sufficient").asBoolean());
    }

    @Test
    @DisplayName("markdown fence with surrounding prose")
    void fencedWithProse() {
        String raw = "Here is my assessment:\n```json\n{\"sufficient\": false, \"reasoning\": \"only {2} items\"}\n```\nThanks.";
        Optional<JsonNode> node = parser.parseObject(raw);
        assertTrue(node.isPresent());
        assertFalse(node.get().path("sufficient").asBoolean(true));
        assertEquals("only {2} items", node.get().path("reasoning").asText());
    }

    @Test
    @DisplayName("nested objects are kept whole")
    void nested() {
        Optional<JsonNode> node = parser.parseObject("x {\"plan\": {\"days\": 90}} y {\"other\": 1}");
        assertTrue(node.isPresent());
        assertEquals(90, node.get().path("plan").path("days").asInt());
        assertFalse(node.get().has("other"));
    }

    @Test
    @DisplayName("no object, malformed or blank → empty")
    void fallbacks() {
        assertTrue(parser.parseObject("no json here").isEmpty());
        assertTrue(parser.parseObject("{\"a\": }").isEmpty());
        assertTrue(parser.parseObject("   ").isEmpty());
        assertTrue(parser.parseObject(null).isEmpty());
    }
}
