package com.care.assist.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 風險判定結果 (Risk Verdict)
 * <p>
 * 產生後不可變；附加到 Session 的風險歷史後不會被回溯修改。
 *
 * @param severity    風險等級
 * @param confidence  信心分數（0.0 - 1.0）
 * @param signals     命中的訊號識別碼
 * @param degraded    是否在協作者失效下產生（保守上調）
 * @param timestampMs 產生時間
 */
public record RiskVerdict(
        Severity severity,
        double confidence,
        List<String> signals,
        boolean degraded,
        long timestampMs) {

    public RiskVerdict {
        severity = severity != null ? severity : Severity.NONE;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        signals = signals != null ? List.copyOf(signals) : List.of();
    }

    public static RiskVerdict none(long timestampMs) {
        return new RiskVerdict(Severity.NONE, 0.0, List.of(), false, timestampMs);
    }

    public boolean requiresEscalation() {
        return severity.isAtLeast(Severity.HIGH);
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    /**
     * 轉為 Ledger payload，供 replay 還原
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("severity", severity.name());
        out.put("confidence", confidence);
        out.put("signals", new ArrayList<>(signals));
        out.put("degraded", degraded);
        out.put("verdictAt", timestampMs);
        return out;
    }

    public static RiskVerdict fromPayload(Map<String, Object> payload) {
        Severity severity = Severity.parse(String.valueOf(payload.get("severity")), Severity.NONE);
        double confidence = payload.get("confidence") instanceof Number n ? n.doubleValue() : 0.0;
        List<String> signals = new ArrayList<>();
        if (payload.get("signals") instanceof List<?> list) {
            for (Object o : list) {
                signals.add(String.valueOf(o));
            }
        }
        boolean degraded = Boolean.TRUE.equals(payload.get("degraded"));
        long ts = payload.get("verdictAt") instanceof Number n ? n.longValue() : 0L;
        return new RiskVerdict(severity, confidence, signals, degraded, ts);
    }
}
