package com.swingtrader.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Body of {@code POST /dag/execute}; both the body and its input are optional. */
public record ExecuteRequest(
    @JsonProperty("initialInput") @JsonAlias("initial_input") Map<String, Object> initialInput
) {}
