package com.swingtrader.common.unit;

public enum UnitStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
