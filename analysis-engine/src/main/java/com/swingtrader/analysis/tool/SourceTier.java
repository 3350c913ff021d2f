package com.swingtrader.analysis.tool;

/**
 * Selection preference of a data source. Declaration order is the order the
 * collection loop tries them in.
 */
public enum SourceTier {
    PRIMARY,
    ALTERNATE,
    SUPPLEMENTARY
}
