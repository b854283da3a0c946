package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A job request as received from the routing layer. {@code parameters} is parsed against the shape
 * bound to {@code type} before anything is stored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobSubmission(String type, JsonNode parameters, Integer priority, String owner) {}
