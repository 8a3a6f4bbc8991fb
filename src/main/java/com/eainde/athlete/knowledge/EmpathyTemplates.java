package com.eainde.athlete.knowledge;

import com.eainde.athlete.state.EmotionalState;
import org.springframework.stereotype.Component;

/**
 * Tone adjustments for users who are not in a neutral emotional state: a preamble for fixed
 * answers and tone guidance for generated ones.
 */
@Component
public class EmpathyTemplates {

    static final String MENTAL_HEALTH_RESOURCE = "USOPC Mental Health Support: contact the USOPC Athlete Services "
            + "team or call the Mental Health Helpline at 1-888-602-9002 for free, confidential support.";

    public String preamble(EmotionalState state) {
        switch (state) {
            case DISTRESSED:
                return "I hear you, and what you're feeling is valid. You are not alone in this, and support "
                        + "is available.\n\n" + MENTAL_HEALTH_RESOURCE + "\n\nHere's what I can share about your "
                        + "situation:\n\n";
            case PANICKED:
                return "I understand this feels overwhelming right now. Take a breath: there are concrete steps "
                        + "you can take, and I'll walk you through them.\n\n";
            case FEARFUL:
                return "Retaliation protections exist to keep you safe, and there are confidential ways to get "
                        + "help. You have the right to speak up without fear of losing your place.\n\n";
            default:
                return "";
        }
    }

    public String withPreamble(String answer, EmotionalState state) {
        return preamble(state) + answer;
    }

    public String toneGuidance(EmotionalState state) {
        switch (state) {
            case DISTRESSED:
                return "TONE: the user is emotionally distressed. Use a warm, supportive tone, acknowledge their "
                        + "feelings before procedural information, and frame action steps as options.";
            case PANICKED:
                return "TONE: the user is panicked. Use calm, reassuring language, present steps in a clear order "
                        + "and avoid alarming wording.";
            case FEARFUL:
                return "TONE: the user is fearful, likely of retaliation. Emphasize confidentiality and "
                        + "anti-retaliation protections and frame reporting as safe and protected.";
            default:
                return "";
        }
    }
}
