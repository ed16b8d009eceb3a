package com.care.assist.service;

import com.care.assist.model.RedactionResult;

import java.util.Map;

/**
 * 遮罩服務介面 (Redaction Gate)
 * 位於原始對話內容與任何保存、輸出之間的無狀態轉換
 */
public interface RedactionService {

    /**
     * 遮罩單段文字
     *
     * @param text 原始文字（可為 null）
     * @return 遮罩後文字與實體清單；無法判讀時整段遮罩
     */
    RedactionResult redact(String text);

    /**
     * 遞迴遮罩 payload 中所有字串值（系統產生的 *Id 欄位除外）
     *
     * @param payload 事件內容
     * @return 新的遮罩後 Map，原 Map 不會被修改
     */
    Map<String, Object> redactPayload(Map<String, Object> payload);
}
