package com.example.console.abac.model;

/**
 * A version together with its policy document.
 */
public record PolicyVersionView(PolicyVersion version, PolicyDocument policy) {
}
