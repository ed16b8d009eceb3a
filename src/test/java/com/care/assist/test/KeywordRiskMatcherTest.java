package com.care.assist.test;

import com.care.assist.model.RiskVerdict;
import com.care.assist.model.Severity;
import com.care.assist.util.KeywordRiskMatcher;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 關鍵字風險比對測試
 */
public class KeywordRiskMatcherTest {

    private static KeywordRiskMatcher matcher;

    @BeforeAll
    public static void setUp() {
        matcher = KeywordRiskMatcher.fromClasspath("risk-keywords.json");
    }

    @Test
    @DisplayName("立即性自殺表述為 CRITICAL")
    public void testImminentIsCritical() {
        RiskVerdict verdict = matcher.assess("I am going to kill myself tonight", List.of(), 1L);

        assertEquals(Severity.CRITICAL, verdict.severity());
        assertTrue(verdict.signals().contains("keyword:suicide_imminent"));
        assertFalse(verdict.degraded());
        assertTrue(verdict.confidence() > 0.6);
    }

    @Test
    @DisplayName("自殺意念為 HIGH")
    public void testIdeationIsHigh() {
        RiskVerdict verdict = matcher.assess("sometimes I just want to die", List.of(), 1L);

        assertEquals(Severity.HIGH, verdict.severity());
        assertTrue(verdict.requiresEscalation());
    }

    @Test
    @DisplayName("自傷加上立即性指標會上調一級")
    public void testImmediacyRaisesSelfHarm() {
        RiskVerdict verdict = matcher.assess("I want to hurt myself right now", List.of(), 1L);

        assertEquals(Severity.HIGH, verdict.severity());
        assertTrue(verdict.signals().contains("indicator:immediacy"));
    }

    @Test
    @DisplayName("一般訊息無風險")
    public void testNeutralText() {
        RiskVerdict verdict = matcher.assess("I had a long day at work and I feel tired", List.of(), 1L);

        assertEquals(Severity.NONE, verdict.severity());
        assertTrue(verdict.signals().isEmpty());
    }

    @Test
    @DisplayName("近期上下文中的危機訊號最多貢獻 LOW")
    public void testContextContributesLow() {
        RiskVerdict verdict = matcher.assess("ok", List.of("I feel so desperate lately"), 1L);

        assertEquals(Severity.LOW, verdict.severity());
        assertTrue(verdict.signals().contains("context:crisis"));
    }

    @Test
    @DisplayName("關鍵字需完整字詞比對")
    public void testWordBoundaries() {
        RiskVerdict verdict = matcher.assess("the suicidesquad movie was fun", List.of(), 1L);

        assertEquals(Severity.NONE, verdict.severity());
    }
}
