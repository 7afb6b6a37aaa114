package io.engram.core.consolidation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fail-closed validation of an advisor reply: a bare JSON array with one object per batch member, each
 * carrying a unique integral {@code id} in {@code 1..n}, a known {@code decision} and an optional string
 * {@code reason}. Decisions come back ordered by id.
 */
public final class ConsolidationResponseParser {
    private final ObjectMapper mapper;

    public ConsolidationResponseParser() {
        this(new ObjectMapper());
    }

    public ConsolidationResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<BatchDecision> parse(String body, int batchSize) throws AdvisorException {
        if (body == null || body.isBlank()) {
            throw new AdvisorException("Advisor returned an empty response");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body.trim());
        } catch (JsonProcessingException e) {
            throw new AdvisorException("Advisor response is not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new AdvisorException("Advisor response must be a JSON array");
        }
        if (root.size() != batchSize) {
            throw new AdvisorException("Advisor returned " + root.size() + " decisions for a batch of " + batchSize);
        }

        List<BatchDecision> decisions = new ArrayList<>(batchSize);
        Set<Integer> seen = new HashSet<>();
        for (JsonNode item : root) {
            if (!item.isObject()) {
                throw new AdvisorException("Advisor decision must be a JSON object: " + item);
            }
            JsonNode id = item.get("id");
            if (id == null || !id.isIntegralNumber() || !id.canConvertToInt()) {
                throw new AdvisorException("Advisor decision has no integral id: " + item);
            }
            int ordinal = id.intValue();
            if (ordinal < 1 || ordinal > batchSize) {
                throw new AdvisorException("Advisor decision id " + ordinal + " is outside 1.." + batchSize);
            }
            if (!seen.add(ordinal)) {
                throw new AdvisorException("Advisor returned id " + ordinal + " more than once");
            }
            JsonNode decision = item.get("decision");
            if (decision == null || !decision.isTextual()) {
                throw new AdvisorException("Advisor decision " + ordinal + " has no decision");
            }
            ReviewCategory category;
            try {
                category = ReviewCategory.parse(decision.asText());
            } catch (IllegalArgumentException e) {
                throw new AdvisorException("Advisor decision " + ordinal + ": " + e.getMessage(), e);
            }
            JsonNode reason = item.get("reason");
            if (reason != null && !reason.isNull() && !reason.isTextual()) {
                throw new AdvisorException("Advisor decision " + ordinal + " has a non-string reason");
            }
            decisions.add(new BatchDecision(ordinal, category, reason == null || reason.isNull() ? "" : reason.asText()));
        }
        decisions.sort(Comparator.comparingInt(BatchDecision::ordinal));
        return decisions;
    }
}
