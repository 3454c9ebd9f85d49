package com.vcsight.ingestor.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The closed set of top-level document shapes the extractor recognises.
 *
 * Every shape reduces a document to its <em>leaf result objects</em>, the
 * per-host / per-item objects that get scanned for VMs and alarms. Shapes
 * are tried in declaration order; {@link #DIRECT} accepts anything.
 */
enum DocumentShape {

    /** {@code plays[].tasks[].hosts.{host}} as written by a playbook JSON callback. */
    PLAYBOOK {
        @Override
        boolean matches(JsonNode doc) {
            return doc.isObject() && doc.has("plays");
        }

        @Override
        List<JsonNode> leaves(JsonNode doc) {
            List<JsonNode> leaves = new ArrayList<>();
            for (JsonNode play : elements(doc.get("plays"))) {
                for (JsonNode task : elements(play.get("tasks"))) {
                    JsonNode hosts = task.get("hosts");
                    if (hosts != null && hosts.isObject()) {
                        hosts.elements().forEachRemaining(hostResult -> addIfObject(leaves, hostResult));
                    }
                }
            }
            return leaves;
        }
    },

    /** A top-level {@code results} array, or a single {@code results} object. */
    RESULTS {
        @Override
        boolean matches(JsonNode doc) {
            return doc.isObject() && doc.has("results");
        }

        @Override
        List<JsonNode> leaves(JsonNode doc) {
            JsonNode results = doc.get("results");
            List<JsonNode> leaves = new ArrayList<>();
            if (results.isArray()) {
                results.forEach(item -> addIfObject(leaves, item));
            } else {
                addIfObject(leaves, results);
            }
            return leaves;
        }
    },

    /** A gathered-facts document: the {@code ansible_facts} object is the only leaf. */
    FACTS {
        @Override
        boolean matches(JsonNode doc) {
            return doc.isObject() && doc.has("ansible_facts");
        }

        @Override
        List<JsonNode> leaves(JsonNode doc) {
            List<JsonNode> leaves = new ArrayList<>();
            addIfObject(leaves, doc.get("ansible_facts"));
            return leaves;
        }
    },

    /** Fallback: the document itself, or each object element of a top-level list. */
    DIRECT {
        @Override
        boolean matches(JsonNode doc) {
            return true;
        }

        @Override
        List<JsonNode> leaves(JsonNode doc) {
            List<JsonNode> leaves = new ArrayList<>();
            if (doc.isArray()) {
                doc.forEach(item -> addIfObject(leaves, item));
            } else {
                addIfObject(leaves, doc);
            }
            return leaves;
        }
    };

    abstract boolean matches(JsonNode doc);

    abstract List<JsonNode> leaves(JsonNode doc);

    static DocumentShape of(JsonNode doc) {
        for (DocumentShape shape : values()) {
            if (shape.matches(doc)) return shape;
        }
        return DIRECT;
    }

    private static Iterable<JsonNode> elements(JsonNode node) {
        return node != null && node.isArray() ? node : List.of();
    }

    private static void addIfObject(List<JsonNode> leaves, JsonNode node) {
        if (node != null && node.isObject()) leaves.add(node);
    }
}
