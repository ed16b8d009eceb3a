package com.care.assist.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Ollama HTTP 用戶端 (Ollama Client)
 * <p>
 * 功能：
 * 封裝對 Ollama {@code /api/generate} 的同步呼叫 (stream=false)，
 * 供語言生成與風險分類兩個協作者共用。
 */
@Component
public class OllamaClient {

    private static final Logger logger = LoggerFactory.getLogger(OllamaClient.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:ministral:8b}")
    private String model;

    @Value("${ollama.timeout:60000}")
    private int timeout;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * 同步呼叫 (Synchronous Call)
     * <p>
     * 流程：
     * 1. 建立 HTTP POST 連線至 `/api/generate`。
     * 2. 建構 JSON Body (包含 model, prompt, options)。
     * 3. 逐行讀取回應並組合 `response` 欄位。
     *
     * @param prompt      提示詞
     * @param temperature 溫度參數 (0-1)
     * @return 完整回應字串
     */
    public String call(String prompt, double temperature) {
        try {
            Map<String, Object> request = new HashMap<>();
            request.put("model", model);
            request.put("prompt", prompt);
            request.put("stream", false);

            Map<String, Object> options = new HashMap<>();
            options.put("temperature", temperature);
            request.put("options", options);

            HttpURLConnection conn = (HttpURLConnection) URI.create(baseUrl + "/api/generate").toURL().openConnection();
            conn.setConnectTimeout(timeout);
            conn.setReadTimeout(timeout);
            conn.setRequestMethod("POST");
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json");

            try (OutputStream os = conn.getOutputStream()) {
                os.write(objectMapper.writeValueAsBytes(request));
            }

            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(conn.getInputStream(), StandardCharsets.UTF_8))) {
                StringBuilder sb = new StringBuilder();
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    JsonNode node = objectMapper.readTree(line);
                    if (node.has("response")) {
                        sb.append(node.get("response").asText());
                    }
                }
                return sb.toString();
            }
        } catch (Exception e) {
            logger.error("Ollama API 呼叫失敗: {}", e.getMessage());
            throw new IllegalStateException("LLM 呼叫失敗", e);
        }
    }
}
