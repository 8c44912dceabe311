package com.postcraft.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.postcraft.domain.generation.model.CopyField;
import com.postcraft.domain.generation.model.PostCopy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the text provider's JSON answer into {@link PostCopy}.
 */
@Component
@RequiredArgsConstructor
public class CopyResponseParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the answer is not a JSON object or a required field is missing
     */
    public PostCopy parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Copy response is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw.trim()));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Copy response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Copy response is not a JSON object");
        }

        for (CopyField field : CopyField.values()) {
            if (field.required() && text(root, field).isEmpty()) {
                throw new IllegalArgumentException("Copy response is missing " + field.jsonKey());
            }
        }

        return new PostCopy(
                text(root, CopyField.HEADLINE),
                text(root, CopyField.SUBHEADLINE),
                text(root, CopyField.CAPTION),
                text(root, CopyField.CALL_TO_ACTION),
                hashtags(root.path("hashtags")));
    }

    private static String text(JsonNode root, CopyField field) {
        JsonNode node = root.path(field.jsonKey());
        // JSON null would otherwise read as the text "null"
        if (node.isNull() || node.isMissingNode() || !node.isValueNode()) {
            return "";
        }
        return node.asText().trim();
    }

    private static List<String> hashtags(JsonNode node) {
        List<String> raw = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(tag -> {
                if (tag.isValueNode() && !tag.isNull()) {
                    raw.add(tag.asText());
                }
            });
        } else if (node.isTextual()) {
            raw.addAll(List.of(node.asText().split("[\\s,]+")));
        }

        Set<String> tags = new LinkedHashSet<>();
        for (String tag : raw) {
            String cleaned = tag.trim().replaceAll("^#+", "").replaceAll("\\s+", "");
            if (!cleaned.isEmpty()) {
                tags.add("#" + cleaned);
            }
        }
        return List.copyOf(tags);
    }

    // Some models wrap JSON in a markdown fence even in JSON mode
    private static String stripCodeFence(String raw) {
        if (!raw.startsWith("```")) {
            return raw;
        }
        int firstNewline = raw.indexOf('\n');
        int lastFence = raw.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return raw;
        }
        return raw.substring(firstNewline + 1, lastFence).trim();
    }
}
