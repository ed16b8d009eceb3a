package com.care.assist.model;

/**
 * 外部風險分類器的輸出
 */
public record ClassifierResult(Severity severity, double confidence) {
}
