package com.care.assist.model;

import java.util.Locale;

/**
 * 同意訊號 (Consent Signal)
 * <p>
 * 只有 GRANTED 代表同意；缺漏或格式錯誤一律視為 NONE（fail closed）。
 */
public enum ConsentSignal {
    NONE,
    GRANTED,
    DENIED,
    REVOKED;

    public static ConsentSignal parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return ConsentSignal.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
