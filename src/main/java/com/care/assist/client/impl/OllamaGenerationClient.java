package com.care.assist.client.impl;

import com.care.assist.client.GenerationClient;
import com.care.assist.model.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Ollama 語言生成實作
 * <p>
 * 依階段組合角色提示詞，並要求模型在使用者需要資源時附上
 * {@link GenerationClient#RESOURCE_MARKER}。時限與失敗後備由 State Machine 處理。
 */
@Component
@ConditionalOnProperty(name = "assist.generation.enabled", havingValue = "true")
public class OllamaGenerationClient implements GenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(OllamaGenerationClient.class);

    private static final String SAFETY_RULES = """
            Rules:
            - Never provide a medical diagnosis or recommend medication.
            - Never promise confidentiality you cannot guarantee.
            - Use short, warm, plain sentences.
            - If the person asks for or clearly needs hotlines or services, end your reply with %s
            """.formatted(RESOURCE_MARKER);

    private final OllamaClient ollamaClient;

    public OllamaGenerationClient(OllamaClient ollamaClient) {
        this.ollamaClient = ollamaClient;
    }

    @Override
    public String generate(Phase phase, String sanitizedContext) {
        String prompt = roleFor(phase) + "\n\n" + SAFETY_RULES + "\nConversation (personal details masked):\n"
                + (sanitizedContext != null ? sanitizedContext : "") + "\n\nReply:";
        String reply = ollamaClient.call(prompt, 0.4);
        if (reply == null || reply.isBlank()) {
            throw new IllegalStateException("empty generation reply");
        }
        logger.debug("生成回覆完成: phase={}, length={}", phase, reply.length());
        return reply.trim();
    }

    private String roleFor(Phase phase) {
        return switch (phase) {
            case INIT, CONSENTED -> "You are a welcoming and compassionate greeter for an emotional support service. "
                    + "Explain that this is not a replacement for professional care and ask for consent to continue.";
            case TRIAGE -> "You are a gentle intake listener. Ask one open question to understand what brought the person here today.";
            case RESOURCES -> "You are a resource guide. Briefly introduce the support services that follow.";
            case CLOSE -> "You are closing the conversation. Thank the person and remind them help is available at any time.";
            default -> "You are an empathetic supportive listener. Reflect feelings, validate, and encourage healthy coping.";
        };
    }
}
