package com.care.assist.model;

/**
 * 支援資源（熱線、簡訊專線、網站）
 */
public record SupportResource(
        String id,
        String name,
        String category,
        String phone,
        String textNumber,
        String website,
        String hours,
        String description) {
}
