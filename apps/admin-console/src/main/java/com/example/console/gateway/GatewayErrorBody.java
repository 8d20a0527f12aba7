package com.example.console.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Error body of the identity gateway: {@code {"error": "...", "message": "..."}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayErrorBody(String error, String message) {
}
