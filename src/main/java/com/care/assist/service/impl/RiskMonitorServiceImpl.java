package com.care.assist.service.impl;

import com.care.assist.client.RiskClassifierClient;
import com.care.assist.config.SessionPolicy;
import com.care.assist.exception.CollaboratorTimeoutException;
import com.care.assist.model.ClassifierResult;
import com.care.assist.model.RiskVerdict;
import com.care.assist.model.Severity;
import com.care.assist.service.RiskMonitorService;
import com.care.assist.util.CollaboratorExecutor;
import com.care.assist.util.KeywordRiskMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Future;

/**
 * 風險監測服務實作 (Risk Monitor Implementation)
 * <p>
 * 功能：
 * 結合兩條路徑判定單一回合的風險：
 * 1. 關鍵字路徑：{@link KeywordRiskMatcher}，永遠可用、結果可重現。
 * 2. 分類器路徑：{@link RiskClassifierClient}（可選），在協作者執行緒池上與關鍵字路徑並行，受時限約束。
 * <p>
 * 合併規則：
 * - 取兩者中較高的等級（不取平均），信心分數取勝出的那一方。
 * - 訊號取聯集；任一方 degraded 則結果 degraded。
 * - 分類器逾時、被拒或失敗時，分類器路徑視為 MEDIUM + degraded。
 */
@Service
public class RiskMonitorServiceImpl implements RiskMonitorService {

    private static final Logger logger = LoggerFactory.getLogger(RiskMonitorServiceImpl.class);

    static final String CLASSIFIER = "risk-classifier";
    static final String CLASSIFIER_UNAVAILABLE = "classifier:unavailable";
    static final double DEGRADED_CONFIDENCE = 0.5;

    private final KeywordRiskMatcher keywordMatcher;
    private final RiskClassifierClient classifier;
    private final CollaboratorExecutor executor;
    private final SessionPolicy policy;
    private final Clock clock;

    public RiskMonitorServiceImpl(KeywordRiskMatcher keywordMatcher,
                                  Optional<RiskClassifierClient> classifier,
                                  CollaboratorExecutor executor,
                                  SessionPolicy policy,
                                  Clock clock) {
        this.keywordMatcher = keywordMatcher;
        this.classifier = classifier.orElse(null);
        this.executor = executor;
        this.policy = policy;
        this.clock = clock;
        logger.info("風險監測初始化完成，外部分類器: {}", this.classifier != null ? "已啟用" : "未啟用");
    }

    @Override
    public boolean classifierConfigured() {
        return classifier != null;
    }

    @Override
    public RiskVerdict assess(String sanitizedText, List<String> recentContext) {
        String text = sanitizedText != null ? sanitizedText : "";

        Future<ClassifierResult> pending = null;
        boolean classifierFailed = false;
        if (classifier != null) {
            try {
                pending = executor.submit(CLASSIFIER, () -> classifier.classify(text));
            } catch (CollaboratorTimeoutException e) {
                classifierFailed = true;
            }
        }

        RiskVerdict keyword = keywordMatcher.assess(text, recentContext, clock.millis());

        if (classifier == null) {
            return keyword;
        }

        ClassifierResult result = null;
        if (pending != null) {
            try {
                result = executor.await(CLASSIFIER, pending, policy.classifierTimeoutMs());
            } catch (CollaboratorTimeoutException e) {
                classifierFailed = true;
            }
        }
        if (result == null || result.severity() == null) {
            classifierFailed = true;
        }

        long now = clock.millis();
        if (classifierFailed) {
            logger.warn("分類器不可用，風險判定降級（關鍵字等級: {}）", keyword.severity());
            return combine(keyword, Severity.MEDIUM, DEGRADED_CONFIDENCE, CLASSIFIER_UNAVAILABLE, true, now);
        }
        return combine(keyword, result.severity(), result.confidence(),
                "classifier:" + result.severity().name().toLowerCase(Locale.ROOT), false, now);
    }

    private RiskVerdict combine(RiskVerdict keyword, Severity other, double otherConfidence,
                                String otherSignal, boolean degraded, long now) {
        Set<String> signals = new LinkedHashSet<>(keyword.signals());
        if (other != Severity.NONE || degraded) {
            signals.add(otherSignal);
        }
        Severity severity;
        double confidence;
        if (keyword.severity().compareTo(other) >= 0) {
            severity = keyword.severity();
            confidence = keyword.confidence();
        } else {
            severity = other;
            confidence = otherConfidence;
        }
        return new RiskVerdict(severity, confidence, new ArrayList<>(signals),
                degraded || keyword.degraded(), now);
    }
}
