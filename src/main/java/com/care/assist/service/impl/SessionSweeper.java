package com.care.assist.service.impl;

import com.care.assist.service.SessionRegistryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期觸發 Session 清理
 */
@Component
@ConditionalOnProperty(name = "assist.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class SessionSweeper {

    private static final Logger logger = LoggerFactory.getLogger(SessionSweeper.class);

    private final SessionRegistryService registry;

    public SessionSweeper(SessionRegistryService registry) {
        this.registry = registry;
    }

    @Scheduled(fixedDelayString = "${assist.sweep.interval-ms:30000}",
            initialDelayString = "${assist.sweep.interval-ms:30000}")
    public void sweep() {
        try {
            registry.sweep();
        } catch (RuntimeException e) {
            logger.error("Session 清理失敗: {}", e.getMessage(), e);
        }
    }
}
