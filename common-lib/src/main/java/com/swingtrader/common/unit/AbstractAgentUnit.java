package com.swingtrader.common.unit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.common.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Base unit implementing the validate → run → execute contract.
 *
 * <p>{@link #validate} binds the raw map onto the typed input {@code I} through Jackson,
 * then asks the subclass for schema violations. Every violation is collected before
 * rejecting, so a caller sees all problems at once.
 *
 * <p>{@link #execute} wraps both phases and converts anything thrown into a
 * {@link UnitOutcome#failed failed outcome}. Nothing escapes it.
 *
 * @param <I> the validated input type
 */
public abstract class AbstractAgentUnit<I> implements AgentUnit {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final ObjectMapper objectMapper;
    private final Class<I> inputType;
    private final String unitName;

    protected AbstractAgentUnit(String unitName, Class<I> inputType, ObjectMapper objectMapper) {
        this.unitName     = unitName;
        this.inputType    = inputType;
        this.objectMapper = objectMapper;
    }

    @Override
    public String unitName() {
        return unitName;
    }

    /**
     * Checks the raw input against the unit's schema.
     *
     * @throws ValidationException listing every violation when the input is rejected
     */
    public I validate(Map<String, Object> rawInput) {
        Map<String, Object> source = rawInput == null ? Map.of() : rawInput;
        I bound;
        try {
            bound = objectMapper.convertValue(source, inputType);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(unitName, bindingViolations(source, e));
        }
        List<String> violations = new ArrayList<>();
        collectViolations(bound, violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(unitName, violations);
        }
        return bound;
    }

    /** Domain work on an already-validated input. May throw; {@link #execute} tags the failure. */
    protected abstract Object run(I input);

    /** Adds a human-readable message to {@code violations} for each schema rule {@code input} breaks. */
    protected abstract void collectViolations(I input, List<String> violations);

    @Override
    public UnitOutcome execute(Map<String, Object> rawInput) {
        I input;
        try {
            input = validate(rawInput);
        } catch (ValidationException e) {
            log.warn("[{}] VALIDATION_FAILED violations={}", unitName, e.getViolations());
            return UnitOutcome.failed(ErrorKind.VALIDATION, e.getMessage());
        }
        try {
            Object result = run(input);
            return UnitOutcome.succeeded(toOutputMap(result));
        } catch (RuntimeException e) {
            log.error("[{}] EXECUTION_FAILED error={}", unitName, e.getMessage(), e);
            return UnitOutcome.failed(ErrorKind.UNIT_EXECUTION, e.getMessage());
        }
    }

    protected Map<String, Object> toOutputMap(Object result) {
        if (result == null) {
            return Map.of();
        }
        return objectMapper.convertValue(result, MAP_TYPE);
    }

    /**
     * Jackson stops at the first field it cannot bind, so each field is bound again on its own
     * to report every one that fails.
     */
    private List<String> bindingViolations(Map<String, Object> source, IllegalArgumentException first) {
        List<String> violations = new ArrayList<>();
        source.forEach((field, value) -> {
            try {
                objectMapper.convertValue(Collections.singletonMap(field, value), inputType);
            } catch (IllegalArgumentException e) {
                violations.add(field + ": " + rootMessage(e));
            }
        });
        if (violations.isEmpty()) {
            violations.add(rootMessage(first));
        }
        return violations;
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        String msg = t.getMessage();
        if (msg == null) return t.getClass().getSimpleName();
        int nl = msg.indexOf('\n');
        return nl > 0 ? msg.substring(0, nl) : msg;
    }
}
