package com.care.assist.client.impl;

import com.care.assist.client.GenerationClient;
import com.care.assist.model.Phase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 固定模板回覆（未啟用 LLM 時的預設實作）
 */
@Component
@ConditionalOnProperty(name = "assist.generation.enabled", havingValue = "false", matchIfMissing = true)
public class TemplateGenerationClient implements GenerationClient {

    public static final String SAFE_FALLBACK =
            "I'm here with you. If you are in danger right now, please call your local emergency number "
                    + "or the 988 Suicide & Crisis Lifeline.";

    @Override
    public String generate(Phase phase, String sanitizedContext) {
        return messageFor(phase);
    }

    public static String messageFor(Phase phase) {
        return switch (phase) {
            case INIT -> "Welcome. This is a peer support service, not a replacement for professional care. "
                    + "Do you agree to continue?";
            case CONSENTED, TRIAGE -> "Thank you for reaching out. Can you tell me a little about what's going on today?";
            case SUPPORT_LOOP, RISK_CHECK -> "Thank you for sharing that with me. How are you feeling right now?";
            case RESOURCES -> "Here are some services that can help.";
            case ESCALATE -> "I'm connecting you with someone who can help right now. Please stay with me.";
            case CLOSE -> "Thank you for talking with me. Help is available any time you need it.";
        };
    }
}
