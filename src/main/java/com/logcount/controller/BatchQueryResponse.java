package com.logcount.controller;

import java.util.Map;

/**
 * Results of a {@link BatchQueryRequest}, keyed by {@code refId}.
 */
public record BatchQueryResponse(Map<String, CountResponse> results) {}
