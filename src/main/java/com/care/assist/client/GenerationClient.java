package com.care.assist.client;

import com.care.assist.model.Phase;

/**
 * 語言生成協作者介面
 * 只用於非升級階段；失敗時由呼叫端改用固定安全訊息
 */
public interface GenerationClient {

    /**
     * 回覆中出現此標記代表建議提供資源；標記不會傳給使用者
     */
    String RESOURCE_MARKER = "[[RESOURCES]]";

    /**
     * 產生回覆
     *
     * @param phase            目前階段
     * @param sanitizedContext 遮罩後的對話內容
     * @return 回覆文字
     */
    String generate(Phase phase, String sanitizedContext);
}
