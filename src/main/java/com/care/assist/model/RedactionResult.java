package com.care.assist.model;

import java.util.List;

/**
 * 遮罩結果：處理後文字與偵測到的實體清單
 */
public record RedactionResult(String sanitizedText, List<RedactedEntity> entities, boolean failedClosed) {

    public RedactionResult {
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    public int entityCount() {
        return entities.size();
    }
}
