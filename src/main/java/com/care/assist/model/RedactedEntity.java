package com.care.assist.model;

/**
 * 遮罩清單中的一筆實體
 *
 * @param type  實體類型（EMAIL、PHONE ...）
 * @param start 原始文字中的起始位置（含）
 * @param end   原始文字中的結束位置（不含）
 * @param token 穩定、可逆查詢用的替代符號
 */
public record RedactedEntity(String type, int start, int end, String token) {
}
