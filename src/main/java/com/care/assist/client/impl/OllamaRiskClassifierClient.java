package com.care.assist.client.impl;

import com.care.assist.client.RiskClassifierClient;
import com.care.assist.model.ClassifierResult;
import com.care.assist.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Ollama 風險分類器 (Risk Classifier)
 * <p>
 * 功能：
 * 要求 LLM 以 JSON 回傳 {@code severity} 與 {@code confidence}。
 * <p>
 * 與意圖分類不同，解析失敗時直接拋出例外，
 * 由 Risk Monitor 轉為保守的降級判定，而不是默默視為無風險。
 */
@Component
@ConditionalOnProperty(name = "assist.classifier.enabled", havingValue = "true")
public class OllamaRiskClassifierClient implements RiskClassifierClient {

    private final OllamaClient ollamaClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaRiskClassifierClient(OllamaClient ollamaClient) {
        this.ollamaClient = ollamaClient;
    }

    @Override
    public ClassifierResult classify(String sanitizedText) {
        String prompt = String.format(
                """
                        You are a crisis risk classifier for an emotional support service.
                        Rate the suicide / self-harm / harm-to-others risk expressed in the message below.

                        Levels: NONE, LOW, MEDIUM, HIGH, CRITICAL (CRITICAL = imminent danger, plan or means).
                        When unsure, choose the higher level.

                        Message: %s

                        Return JSON only:
                        {"severity": "NONE|LOW|MEDIUM|HIGH|CRITICAL", "confidence": 0.0-1.0}
                        """,
                sanitizedText);
        return parse(ollamaClient.call(prompt, 0.0));
    }

    /**
     * 解析分類結果 (Parse Classifier Result)
     * <p>
     * 使用字串定位 `{` 與 `}` 找到 JSON 區塊後以 Jackson 解析。
     */
    ClassifierResult parse(String response) {
        if (response == null) {
            throw new IllegalStateException("classifier returned no response");
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}') + 1;
        if (start < 0 || end <= start) {
            throw new IllegalStateException("classifier response has no JSON object");
        }
        try {
            JsonNode node = objectMapper.readTree(response.substring(start, end));
            Severity severity = Severity.parse(node.path("severity").asText(null), null);
            if (severity == null) {
                throw new IllegalStateException("classifier severity missing");
            }
            double confidence = node.path("confidence").asDouble(0.5);
            return new ClassifierResult(severity, confidence);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("classifier JSON unreadable", e);
        }
    }
}
