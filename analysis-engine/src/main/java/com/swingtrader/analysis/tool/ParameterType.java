package com.swingtrader.analysis.tool;

public enum ParameterType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN;

    /**
     * Returns {@code value} in this type's canonical Java form, or {@code null} when it
     * cannot be represented. Integral doubles (e.g. {@code 90.0} from JSON) are accepted
     * as INTEGER; values outside the {@code int} range are not.
     */
    Object coerce(Object value) {
        return switch (this) {
            case STRING -> value instanceof CharSequence s ? s.toString() : null;
            case INTEGER -> {
                if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    yield ((Number) value).intValue();
                }
                if (value instanceof Long l) {
                    yield l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? l.intValue() : null;
                }
                if (value instanceof Number n) {
                    double d = n.doubleValue();
                    if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                        yield n.intValue();
                    }
                }
                yield null;
            }
            case NUMBER -> value instanceof Number n ? n.doubleValue() : null;
            case BOOLEAN -> value instanceof Boolean b ? b : null;
        };
    }
}
