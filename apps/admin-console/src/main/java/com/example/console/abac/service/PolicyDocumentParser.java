package com.example.console.abac.service;

import com.example.console.abac.model.PolicyDocument;
import com.example.console.common.AdminOperation;
import com.example.console.common.exception.InvalidInputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Shape check for policy documents before they are sent anywhere.
 *
 * <p>Only structure is checked: an object with a {@code rules} array whose entries
 * are objects. The accepted tree is forwarded as-is, unknown fields included.
 */
@Component
@RequiredArgsConstructor
public class PolicyDocumentParser {

    static final String RULES_REQUIRED = "Policy JSON must be an object with a rules array";

    private final ObjectMapper objectMapper;

    /**
     * Resolves a document given either as a JSON value or as raw JSON text, the
     * value taking precedence. Blank text reads as an empty rule set.
     */
    @NonNull
    public PolicyDocument resolve(@NonNull AdminOperation operation, @Nullable JsonNode policy,
                                  @Nullable String policyJson) {
        if (policy != null && !policy.isNull() && !policy.isMissingNode()) {
            return parse(operation, policy);
        }
        if (policyJson == null) {
            throw InvalidInputException.missingField(operation, "policy");
        }
        return parseText(operation, policyJson);
    }

    @NonNull
    public PolicyDocument parseText(@NonNull AdminOperation operation, @NonNull String policyJson) {
        if (policyJson.isBlank()) {
            return PolicyDocument.empty();
        }
        JsonNode tree;
        try {
            tree = objectMapper.readTree(policyJson);
        } catch (JsonProcessingException e) {
            throw InvalidInputException.invalidDocument(operation, "Policy is not valid JSON: " + e.getOriginalMessage());
        }
        return parse(operation, tree);
    }

    @NonNull
    public PolicyDocument parse(@NonNull AdminOperation operation, @Nullable JsonNode tree) {
        if (tree == null || !tree.isObject() || !tree.path("rules").isArray()) {
            throw InvalidInputException.invalidDocument(operation, RULES_REQUIRED);
        }
        JsonNode rules = tree.get("rules");
        for (int i = 0; i < rules.size(); i++) {
            if (!rules.get(i).isObject()) {
                throw InvalidInputException.invalidDocument(operation, "Rule at index " + i + " must be an object");
            }
        }
        return PolicyDocument.of(tree);
    }
}
