package com.care.assist.statemachine;

import com.care.assist.model.Phase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 階段轉移表
 * <p>
 * 即時處理與事件重播共用同一份表；表外的轉移一律視為錯誤。
 */
public final class TransitionTable {

    private static final Map<Phase, Set<Phase>> ALLOWED = new EnumMap<>(Phase.class);

    static {
        ALLOWED.put(Phase.INIT, EnumSet.of(Phase.CONSENTED, Phase.ESCALATE, Phase.CLOSE));
        ALLOWED.put(Phase.CONSENTED, EnumSet.of(Phase.TRIAGE, Phase.ESCALATE, Phase.CLOSE));
        ALLOWED.put(Phase.TRIAGE, EnumSet.of(Phase.SUPPORT_LOOP, Phase.ESCALATE, Phase.CLOSE));
        ALLOWED.put(Phase.SUPPORT_LOOP, EnumSet.of(Phase.RISK_CHECK, Phase.RESOURCES, Phase.ESCALATE, Phase.CLOSE));
        ALLOWED.put(Phase.RISK_CHECK, EnumSet.of(Phase.SUPPORT_LOOP, Phase.ESCALATE, Phase.CLOSE));
        ALLOWED.put(Phase.RESOURCES, EnumSet.of(Phase.SUPPORT_LOOP, Phase.ESCALATE, Phase.CLOSE));
        ALLOWED.put(Phase.ESCALATE, EnumSet.of(Phase.CLOSE));
        ALLOWED.put(Phase.CLOSE, EnumSet.noneOf(Phase.class));
    }

    private TransitionTable() {
    }

    public static boolean isAllowed(Phase from, Phase to) {
        if (from == null || to == null) {
            return false;
        }
        return ALLOWED.get(from).contains(to);
    }

    public static Set<Phase> targetsOf(Phase from) {
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    /**
     * @throws IllegalStateException 不在表內的轉移
     */
    public static void check(Phase from, Phase to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException("illegal phase transition " + from + " -> " + to);
        }
    }
}
