package com.care.assist.client.impl;

import com.care.assist.client.HandoffClient;
import com.care.assist.model.TransferStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP 轉接用戶端 (Warm Hand-off Client)
 * <p>
 * 將遮罩後的情境摘要 POST 至值班系統的 {@code /handoff}。
 * 未設定 {@code assist.handoff.base-url} 時一律回報 UNAVAILABLE。
 * <p>
 * 回應格式：{@code {"status": "CONNECTED|BUSY|FAILED"}}；HTTP 429/503 視為 BUSY。
 */
@Component
public class HttpHandoffClient implements HandoffClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpHandoffClient.class);

    private final String baseUrl;
    private final int timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HttpHandoffClient(
            @Value("${assist.handoff.base-url:}") String baseUrl,
            @Value("${assist.escalation.handoff-timeout-ms:5000}") int timeout) {
        this.baseUrl = baseUrl != null ? baseUrl.trim() : "";
        this.timeout = timeout;
    }

    @Override
    public TransferStatus initiate(String contextSummary) {
        if (baseUrl.isEmpty()) {
            return TransferStatus.UNAVAILABLE;
        }
        try {
            Map<String, Object> request = new HashMap<>();
            request.put("summary", contextSummary != null ? contextSummary : "");

            HttpURLConnection conn = (HttpURLConnection) URI.create(baseUrl + "/handoff").toURL().openConnection();
            conn.setConnectTimeout(timeout);
            conn.setReadTimeout(timeout);
            conn.setRequestMethod("POST");
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json");

            try (OutputStream os = conn.getOutputStream()) {
                os.write(objectMapper.writeValueAsBytes(request));
            }

            int code = conn.getResponseCode();
            if (code == 429 || code == 503) {
                return TransferStatus.BUSY;
            }
            if (code >= 300) {
                logger.warn("轉接請求失敗: HTTP {}", code);
                return TransferStatus.FAILED;
            }
            try (InputStream in = conn.getInputStream()) {
                JsonNode node = objectMapper.readTree(in);
                String status = node.path("status").asText("CONNECTED");
                try {
                    return TransferStatus.valueOf(status.toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    logger.warn("無法辨識的轉接狀態: {}", status);
                    return TransferStatus.FAILED;
                }
            }
        } catch (SocketTimeoutException e) {
            logger.warn("轉接請求逾時");
            return TransferStatus.TIMEOUT;
        } catch (Exception e) {
            logger.error("轉接請求失敗: {}", e.getMessage());
            return TransferStatus.FAILED;
        }
    }
}
