package com.care.assist.service;

import com.care.assist.model.RiskVerdict;

import java.util.List;

/**
 * 風險監測服務 (Risk Monitor)
 */
public interface RiskMonitorService {

    /**
     * 評估遮罩後的訊息
     *
     * @param sanitizedText  遮罩後的訊息
     * @param recentContext  最近幾回合的遮罩後訊息
     * @return 合併後的判定；協作者失效時為 degraded 的 MEDIUM 以上
     */
    RiskVerdict assess(String sanitizedText, List<String> recentContext);

    /**
     * 是否有設定外部分類器
     */
    boolean classifierConfigured();
}
