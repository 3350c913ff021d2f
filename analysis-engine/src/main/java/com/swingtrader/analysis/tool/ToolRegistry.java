package com.swingtrader.analysis.tool;

import com.swingtrader.analysis.sufficiency.EvidenceItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Name-addressable set of data-fetch tools with declared parameter schemas.
 *
 * <p>Registration happens once while the application context starts. After that the
 * registry is only read, concurrently, by sentiment collection loops.
 *
 * <p>{@link #call} validates arguments strictly: missing required parameters, wrong types
 * and undeclared names are all reported together as {@link ToolException.Kind#INVALID_ARGS}.
 * Optional parameters that are absent are filled from their declared defaults.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolDescriptor> tools = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();

    public synchronized void register(ToolDescriptor descriptor) {
        if (tools.containsKey(descriptor.name())) {
            throw new ToolException(ToolException.Kind.DUPLICATE_TOOL, descriptor.name(),
                "a tool with this name is already registered");
        }
        tools.put(descriptor.name(), descriptor);
        registrationOrder.add(descriptor.name());
        log.info("Tool registered. name={} tier={} available={}",
            descriptor.name(), descriptor.tier(), descriptor.available());
    }

    public List<EvidenceItem> call(String name, Map<String, Object> args) {
        ToolDescriptor tool = tools.get(name);
        if (tool == null) {
            throw new ToolException(ToolException.Kind.UNKNOWN_TOOL, name, "no such tool");
        }
        if (!tool.available()) {
            throw new ToolException(ToolException.Kind.UNAVAILABLE, name, "tool is declared but not available");
        }
        Map<String, Object> validated = validateArgs(tool, args == null ? Map.of() : args);

        log.info("Calling tool. name={} args={}", name, validated);
        List<EvidenceItem> result;
        try {
            result = tool.strategy().fetch(validated);
        } catch (RuntimeException e) {
            log.warn("Tool failed. name={} error={}", name, e.getMessage());
            throw new ToolException(ToolException.Kind.EXECUTION_FAILED, name, String.valueOf(e.getMessage()), e);
        }
        List<EvidenceItem> items = result == null ? List.of() : result;
        log.info("Tool completed. name={} items={}", name, items.size());
        return items;
    }

    /** Registered tools in registration order. */
    public List<ToolMetadata> list() {
        return registrationOrder.stream().map(n -> tools.get(n).metadata()).toList();
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    private static Map<String, Object> validateArgs(ToolDescriptor tool, Map<String, Object> args) {
        List<String> problems = new ArrayList<>();
        Map<String, Object> validated = new LinkedHashMap<>();
        Map<String, ToolParameter> declared = new LinkedHashMap<>();
        tool.parameters().forEach(p -> declared.put(p.name(), p));

        for (String given : args.keySet()) {
            if (!declared.containsKey(given)) {
                problems.add("unknown parameter '" + given + "'");
            }
        }
        for (ToolParameter param : declared.values()) {
            Object raw = args.get(param.name());
            if (raw == null) {
                if (param.required()) {
                    problems.add("missing required parameter '" + param.name() + "'");
                } else if (param.defaultValue() != null) {
                    validated.put(param.name(), param.defaultValue());
                }
                continue;
            }
            Object coerced = param.type().coerce(raw);
            if (coerced == null) {
                problems.add("parameter '" + param.name() + "' expects " + param.type()
                    + " but got " + raw.getClass().getSimpleName());
            } else {
                validated.put(param.name(), coerced);
            }
        }
        if (!problems.isEmpty()) {
            throw new ToolException(ToolException.Kind.INVALID_ARGS, tool.name(), String.join("; ", problems));
        }
        return validated;
    }
}
