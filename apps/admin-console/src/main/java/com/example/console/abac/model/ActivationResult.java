package com.example.console.abac.model;

import com.example.console.abac.version.ActivationPlan;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a publish or rollback.
 *
 * @param listing           tenant history as re-read after the call
 * @param kind              what the call did
 * @param previousVersionId version that was active before, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivationResult(
        PolicyListing listing,
        ActivationPlan.Kind kind,
        @JsonProperty("previous_version_id") String previousVersionId
) {
}
