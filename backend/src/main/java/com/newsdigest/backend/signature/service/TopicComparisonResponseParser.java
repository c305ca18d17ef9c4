package com.newsdigest.backend.signature.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.backend.exception.ComparisonResponseParseException;
import com.newsdigest.backend.signature.dto.TopicComparisonResult;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts the comparison model's JSON reply into a {@link TopicComparisonResult}. Expected shape:
 * {@code {"sameTopic": true, "matchedSignatureId": "...", "confidence": 0.92}}.
 */
@Slf4j
@Component
public class TopicComparisonResponseParser {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public TopicComparisonResult parse(String aiResponse, Set<String> windowSignatureIds) {
        if (aiResponse == null || aiResponse.isBlank()) {
            throw new ComparisonResponseParseException("Empty comparison response");
        }

        // Clean response - remove markdown if present
        String cleanedResponse = aiResponse;
        if (cleanedResponse.contains("```json")) {
            cleanedResponse = cleanedResponse.substring(cleanedResponse.indexOf("```json") + 7);
        }
        if (cleanedResponse.contains("```")) {
            cleanedResponse = cleanedResponse.substring(0, cleanedResponse.lastIndexOf("```"));
        }
        cleanedResponse = cleanedResponse.trim();

        JsonNode root;
        try {
            root = objectMapper.readTree(cleanedResponse);
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse comparison response as JSON: {}", cleanedResponse);
            throw new ComparisonResponseParseException("Comparison response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ComparisonResponseParseException("Comparison response is not a JSON object");
        }

        JsonNode sameTopic = root.get("sameTopic");
        if (sameTopic == null || !sameTopic.isBoolean()) {
            throw new ComparisonResponseParseException("Comparison response has no boolean 'sameTopic'");
        }

        Double confidence = null;
        JsonNode confidenceNode = root.get("confidence");
        if (confidenceNode != null && !confidenceNode.isNull()) {
            if (!confidenceNode.isNumber()) {
                throw new ComparisonResponseParseException("'confidence' must be a number");
            }
            confidence = confidenceNode.asDouble();
            if (confidence < 0.0 || confidence > 1.0) {
                throw new ComparisonResponseParseException("'confidence' out of range: " + confidence);
            }
        }

        if (!sameTopic.asBoolean()) {
            return TopicComparisonResult.unique(confidence);
        }

        JsonNode matched = root.get("matchedSignatureId");
        String signatureId = matched != null && matched.isTextual() ? matched.asText().trim() : null;
        if (signatureId == null || signatureId.isEmpty()) {
            throw new ComparisonResponseParseException("Duplicate verdict without 'matchedSignatureId'");
        }
        if (!windowSignatureIds.contains(signatureId)) {
            throw new ComparisonResponseParseException("Matched signature " + signatureId + " is not in the comparison window");
        }
        return TopicComparisonResult.duplicate(signatureId, confidence);
    }
}
