package com.care.assist.config;

import com.care.assist.model.Severity;
import com.care.assist.util.CollaboratorExecutor;
import com.care.assist.util.KeywordRiskMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 服務組態
 * <p>
 * 將 application.properties 讀成單一不可變的 {@link SessionPolicy}，
 * 並提供時鐘、協作者執行緒池與關鍵字比對器。
 */
@Configuration
public class AssistConfig {

    private static final Logger logger = LoggerFactory.getLogger(AssistConfig.class);

    private static final long MINUTE_MS = 60_000L;

    @Bean
    public SessionPolicy sessionPolicy(
            @Value("${assist.session.max-messages:50}") int maxMessages,
            @Value("${assist.session.idle-timeout-minutes:30}") long idleTimeoutMinutes,
            @Value("${assist.session.hard-timeout-minutes:120}") long hardTimeoutMinutes,
            @Value("${assist.session.consent-timeout-minutes:10}") long consentTimeoutMinutes,
            @Value("${assist.session.closed-retention-minutes:10}") long closedRetentionMinutes,
            @Value("${assist.triage.timeout-minutes:5}") long triageTimeoutMinutes,
            @Value("${assist.triage.required-turns:1}") int triageRequiredTurns,
            @Value("${assist.risk.context-turns:5}") int riskContextTurns,
            @Value("${assist.risk.escalation-threshold:HIGH}") String escalationThreshold,
            @Value("${assist.risk.classifier-timeout-ms:2000}") long classifierTimeoutMs,
            @Value("${assist.generation.timeout-ms:5000}") long generationTimeoutMs,
            @Value("${assist.escalation.handoff-timeout-ms:5000}") long handoffTimeoutMs,
            @Value("${assist.escalation.max-attempts:3}") int maxHandoffAttempts,
            @Value("${assist.escalation.max-retries:3}") int maxEscalationRetries) {
        SessionPolicy policy = SessionPolicy.builder()
                .maxMessages(maxMessages)
                .idleTimeoutMs(idleTimeoutMinutes * MINUTE_MS)
                .hardTimeoutMs(hardTimeoutMinutes * MINUTE_MS)
                .consentTimeoutMs(consentTimeoutMinutes * MINUTE_MS)
                .closedRetentionMs(closedRetentionMinutes * MINUTE_MS)
                .triageTimeoutMs(triageTimeoutMinutes * MINUTE_MS)
                .triageRequiredTurns(triageRequiredTurns)
                .riskContextTurns(riskContextTurns)
                .escalationThreshold(Severity.parse(escalationThreshold, Severity.HIGH))
                .classifierTimeoutMs(classifierTimeoutMs)
                .generationTimeoutMs(generationTimeoutMs)
                .handoffTimeoutMs(handoffTimeoutMs)
                .maxHandoffAttempts(maxHandoffAttempts)
                .maxEscalationRetries(maxEscalationRetries)
                .build();
        logger.info("Session 政策: {}", policy.snapshot());
        return policy;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public CollaboratorExecutor collaboratorExecutor(
            @Value("${assist.collaborator.core-threads:8}") int coreThreads,
            @Value("${assist.collaborator.max-threads:32}") int maxThreads,
            @Value("${assist.collaborator.queue-capacity:200}") int queueCapacity) {
        return new CollaboratorExecutor(coreThreads, maxThreads, queueCapacity);
    }

    @Bean
    public KeywordRiskMatcher keywordRiskMatcher(
            @Value("${assist.risk.keywords-file:risk-keywords.json}") String keywordsFile) {
        return KeywordRiskMatcher.fromClasspath(keywordsFile);
    }
}
