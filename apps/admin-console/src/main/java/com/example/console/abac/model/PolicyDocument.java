package com.example.console.abac.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A tenant policy document. The JSON tree is kept exactly as submitted and is
 * written back to the gateway unchanged; only the gateway interprets rules.
 */
@EqualsAndHashCode
@ToString
public final class PolicyDocument {

    private final ObjectNode tree;

    private PolicyDocument(ObjectNode tree) {
        this.tree = tree;
    }

    @NonNull
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PolicyDocument of(@Nullable JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            throw new IllegalArgumentException("Policy document must be a JSON object");
        }
        return new PolicyDocument(((ObjectNode) tree).deepCopy());
    }

    @NonNull
    public static PolicyDocument empty() {
        ObjectNode tree = JsonNodeFactory.instance.objectNode();
        tree.putArray("rules");
        return new PolicyDocument(tree);
    }

    /** Copy of the document tree. */
    @NonNull
    @JsonValue
    public ObjectNode tree() {
        return tree.deepCopy();
    }

    @NonNull
    public List<JsonNode> rules() {
        List<JsonNode> rules = new ArrayList<>();
        tree.path("rules").forEach(rules::add);
        return List.copyOf(rules);
    }
}
