package com.example.console.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Success body of the identity gateway: {@code {"data": ...}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayEnvelope<T>(T data) {
}
