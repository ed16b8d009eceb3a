package com.care.assist.model;

import java.util.List;

/**
 * 已記錄的回合，只保存遮罩後內容
 */
public record Turn(
        int turnNumber,
        int rawLength,
        String sanitizedText,
        List<RedactedEntity> entities,
        Phase phase,
        ConsentSignal consent,
        boolean exitRequested,
        boolean resourceRequested,
        long receivedAtMs) {

    public Turn {
        entities = entities != null ? List.copyOf(entities) : List.of();
    }
}
