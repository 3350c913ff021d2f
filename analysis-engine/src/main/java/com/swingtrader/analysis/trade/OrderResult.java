package com.swingtrader.analysis.trade;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of an order request. {@code status} is one of {@code success}, {@code skipped}
 * or {@code error}; {@code reason} explains a skip and {@code error} a failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderResult(
    @JsonProperty("status") String status,
    @JsonProperty("order_id") String orderId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("quantity") Integer quantity,
    @JsonProperty("order_type") String orderType,
    @JsonProperty("transaction_type") String transactionType,
    @JsonProperty("paper_trading") Boolean paperTrading,
    @JsonProperty("message") String message,
    @JsonProperty("reason") String reason,
    @JsonProperty("error") String error
) {
    public static final String SUCCESS = "success";
    public static final String SKIPPED = "skipped";
    public static final String ERROR   = "error";

    public static OrderResult skipped(String reason) {
        return new OrderResult(SKIPPED, null, null, null, null, null, null, null, reason, null);
    }

    public static OrderResult error(String error) {
        return new OrderResult(ERROR, null, null, null, null, null, null, null, null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    /** The reason or error text, whichever applies. */
    @JsonIgnore
    public String explanation() {
        return reason != null ? reason : error;
    }
}
