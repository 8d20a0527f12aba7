package com.example.console.abac.model;

public record ActivePolicy(PolicyVersion version, PolicyMode mode) {
}
