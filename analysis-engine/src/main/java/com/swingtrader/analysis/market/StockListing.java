package com.swingtrader.analysis.market;

/** One entry of the screening universe. */
public record StockListing(String symbol, String name) {}
