package com.swingtrader.common.cache;

import java.time.Instant;

record CacheEntry(Object value, Instant storedAt) {}
