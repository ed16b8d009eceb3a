package com.care.assist.service.impl;

import com.care.assist.model.RedactedEntity;
import com.care.assist.model.RedactionResult;
import com.care.assist.service.RedactionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 遮罩服務實作 (Redaction Service Implementation)
 * <p>
 * 功能：
 * 以正規表示式偵測個人可識別資訊 (PII) 並替換為穩定的代號。
 * 偏向保守：判斷不明確時照樣遮罩，誤遮可以接受，漏遮不行。
 * <p>
 * 流程概述：
 * 1. 逐一以各類型 Pattern 掃描原始文字，收集候選區段。
 * 2. 重疊區段採「最左、最長」原則挑選，每個保留區段對應清單中的一筆實體。
 * 3. 以 HMAC-SHA256(type:value) 產生代號 {@code [TYPE_xxxxxxxxxx]}，同值同代號；
 *    本服務不保存任何原始值，可逆查詢需由外部、經同意後的保管庫處理。
 * 4. 輸入過長或比對失敗時 fail closed：整段替換為 {@code [REDACTED]}。
 */
@Service
public class RedactionServiceImpl implements RedactionService {

    private static final Logger logger = LoggerFactory.getLogger(RedactionServiceImpl.class);

    public static final String FULL_MASK = "[REDACTED]";
    public static final String UNCLASSIFIED = "UNCLASSIFIED";

    private static final List<EntityPattern> PATTERNS = List.of(
            new EntityPattern("EMAIL", Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), 0),
            new EntityPattern("SSN", Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), 0),
            new EntityPattern("CREDIT_CARD", Pattern.compile("\\b\\d{4}[- ]?\\d{4}[- ]?\\d{4}[- ]?\\d{4}\\b"), 0),
            new EntityPattern("PHONE",
                    Pattern.compile("(?<!\\w)(?:\\+?1[-. ]?)?\\(?\\d{3}\\)?[-. ]?\\d{3}[-. ]?\\d{4}\\b"), 0),
            new EntityPattern("IP_ADDRESS", Pattern.compile("\\b\\d{1,3}(?:\\.\\d{1,3}){3}\\b"), 0),
            new EntityPattern("DATE",
                    Pattern.compile("\\b\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\b|\\b\\d{4}-\\d{2}-\\d{2}\\b"), 0),
            new EntityPattern("ADDRESS", Pattern.compile(
                    "\\b\\d+\\s+(?:[A-Za-z]+\\s+){1,4}(?:Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd|Lane|Ln|Drive|Dr)\\b",
                    Pattern.CASE_INSENSITIVE), 0),
            new EntityPattern("ZIP_CODE", Pattern.compile("\\b\\d{5}(?:-\\d{4})?\\b"), 0),
            // 自我介紹後的名字不分大小寫；另外任何「大寫開頭的兩個連續單字」都視為全名
            new EntityPattern("NAME", Pattern.compile(
                    "(?i:\\b(?:my name is|i am called|call me)\\s+)([A-Za-z]+(?:\\s+[A-Z][a-z]+)?)"), 1),
            new EntityPattern("NAME", Pattern.compile("\\b[A-Z][a-z]+\\s[A-Z][a-z]+\\b"), 0),
            new EntityPattern("ID_NUMBER", Pattern.compile("\\b\\d{6,}\\b"), 0));

    private final byte[] tokenKey;
    private final int maxInputLength;

    public RedactionServiceImpl(
            @Value("${assist.redaction.token-key:care-assist-default-token-key}") String tokenKey,
            @Value("${assist.redaction.max-input-length:8000}") int maxInputLength) {
        this.tokenKey = tokenKey.getBytes(StandardCharsets.UTF_8);
        this.maxInputLength = maxInputLength;
    }

    @Override
    public RedactionResult redact(String text) {
        if (text == null || text.isEmpty()) {
            return new RedactionResult("", List.of(), false);
        }
        if (text.length() > maxInputLength) {
            logger.warn("輸入長度 {} 超過上限 {}，整段遮罩", text.length(), maxInputLength);
            return failClosed(text);
        }
        try {
            return doRedact(text);
        } catch (RuntimeException | StackOverflowError e) {
            logger.warn("遮罩比對失敗，整段遮罩: {}", e.getClass().getSimpleName());
            return failClosed(text);
        }
    }

    /**
     * 執行遮罩 (Do Redact)
     * <p>
     * 流程：
     * 1. 收集所有 Pattern 的候選區段。
     * 2. 依起點遞增、長度遞減排序，略過與已選區段重疊者。
     * 3. 由左至右組合輸出文字並建立實體清單（位置為原始文字中的位置）。
     */
    private RedactionResult doRedact(String text) {
        List<Candidate> candidates = new ArrayList<>();
        for (int priority = 0; priority < PATTERNS.size(); priority++) {
            EntityPattern ep = PATTERNS.get(priority);
            Matcher m = ep.pattern().matcher(text);
            while (m.find()) {
                int start = m.start(ep.group());
                int end = m.end(ep.group());
                if (start >= 0 && end > start) {
                    candidates.add(new Candidate(ep.type(), start, end, priority));
                }
            }
        }
        if (candidates.isEmpty()) {
            return new RedactionResult(text, List.of(), false);
        }

        candidates.sort(Comparator.comparingInt(Candidate::start)
                .thenComparing(Comparator.comparingInt(Candidate::length).reversed())
                .thenComparingInt(Candidate::priority));

        List<RedactedEntity> entities = new ArrayList<>();
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        for (Candidate c : candidates) {
            if (c.start() < cursor) {
                continue;
            }
            String value = text.substring(c.start(), c.end());
            String token = token(c.type(), value);
            out.append(text, cursor, c.start()).append(token);
            entities.add(new RedactedEntity(c.type(), c.start(), c.end(), token));
            cursor = c.end();
        }
        out.append(text.substring(cursor));
        return new RedactionResult(out.toString(), entities, false);
    }

    private RedactionResult failClosed(String text) {
        return new RedactionResult(FULL_MASK,
                List.of(new RedactedEntity(UNCLASSIFIED, 0, text.length(), FULL_MASK)), true);
    }

    private String token(String type, String value) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(tokenKey, "HmacSHA256"));
            byte[] digest = mac.doFinal((type + ":" + value).getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (int i = 0; i < 5; i++) {
                hex.append(String.format("%02x", digest[i]));
            }
            return "[" + type + "_" + hex + "]";
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    @Override
    public Map<String, Object> redactPayload(Map<String, Object> payload) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (payload == null) {
            return out;
        }
        payload.forEach((k, v) -> out.put(k, isIdentifierKey(k) ? v : redactValue(v)));
        return out;
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value) {
        if (value instanceof String s) {
            return redact(s).sanitizedText();
        }
        if (value instanceof Map<?, ?> map) {
            return redactPayload((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(redactValue(item));
            }
            return copy;
        }
        return value;
    }

    private static boolean isIdentifierKey(String key) {
        return key != null && key.endsWith("Id");
    }

    private record EntityPattern(String type, Pattern pattern, int group) {
    }

    private record Candidate(String type, int start, int end, int priority) {
        int length() {
            return end - start;
        }
    }
}
