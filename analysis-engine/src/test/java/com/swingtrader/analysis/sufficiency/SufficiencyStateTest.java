package com.swingtrader.analysis.sufficiency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SufficiencyStateTest {

    private final SufficiencyState state =
        new SufficiencyState("TCS.NS", "Tata Consultancy", List.of(2, 90, 180), List.of("fetch_news"));

    private static EvidenceItem item(String title, String description) {
        return new EvidenceItem(title, description, null, "wire", null);
    }

    @Test
    @DisplayName("titles differing only in case and spacing count once")
    void sameTitle() {
        state.recordFetch("fetch_news", List.of(item("TCS wins deal", null), item("  tcs WINS deal ", null)));
        assertEquals(1, state.uniqueItemCount());
    }

    @Test
    @DisplayName("untitled items are told apart by their description")
    void untitledByDescription() {
        state.recordFetch("fetch_news", List.of(
            item(null, "Quarterly revenue beats estimates"),
            item("", "Board approves buyback"),
            item(null, "quarterly revenue beats estimates ")));
        assertEquals(2, state.uniqueItemCount());
    }

    @Test
    @DisplayName("items with neither title nor description are all kept")
    void nothingToCompare() {
        state.recordFetch("fetch_news", List.of(item(null, null), item(null, " "), item(null, null)));
        assertEquals(3, state.uniqueItemCount());
    }
}
