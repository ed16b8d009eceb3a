package com.care.assist.model;

/**
 * 呼叫端送入的單一使用者訊息
 *
 * @param text              原始訊息（不會被保存）
 * @param consent           同意訊號，null 視為 NONE
 * @param exitRequested     使用者明確要求結束
 * @param resourceRequested 使用者明確要求資源
 */
public record TurnInput(String text, ConsentSignal consent, boolean exitRequested, boolean resourceRequested) {

    public TurnInput {
        text = text != null ? text : "";
        consent = consent != null ? consent : ConsentSignal.NONE;
    }

    public static TurnInput message(String text) {
        return new TurnInput(text, ConsentSignal.NONE, false, false);
    }

    public static TurnInput consent(ConsentSignal signal) {
        return new TurnInput("", signal, false, false);
    }
}
