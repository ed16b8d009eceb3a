package com.care.assist.client;

import com.care.assist.model.ClassifierResult;

/**
 * 風險分類器協作者介面（可選）
 */
public interface RiskClassifierClient {

    /**
     * 分類遮罩後的訊息
     *
     * @param sanitizedText 遮罩後文字
     * @return 等級與信心分數
     */
    ClassifierResult classify(String sanitizedText);
}
