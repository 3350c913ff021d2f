package com.swingtrader.analysis.reasoning;

/**
 * Opaque language-model call: prompt in, free text out. Callers extract the structured
 * part with {@link com.swingtrader.common.json.StructuredResponseParser} and substitute a
 * fallback when that fails.
 */
public interface ReasoningClient {

    /** False when no credentials are configured; callers go straight to their rule-based path. */
    boolean isConfigured();

    /**
     * @throws ReasoningException on transport failure, timeout or an unreadable envelope
     */
    String complete(String prompt);
}
