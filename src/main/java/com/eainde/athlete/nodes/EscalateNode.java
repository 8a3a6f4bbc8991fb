package com.eainde.athlete.nodes;

import com.eainde.athlete.knowledge.EmpathyTemplates;
import com.eainde.athlete.knowledge.EscalationDirectory;
import com.eainde.athlete.knowledge.EscalationTarget;
import com.eainde.athlete.llm.LlmClient;
import com.eainde.athlete.llm.ModelRole;
import com.eainde.athlete.prompt.PromptService;
import com.eainde.athlete.state.EscalationCategory;
import com.eainde.athlete.state.EscalationInfo;
import com.eainde.athlete.state.EscalationUrgency;
import com.eainde.athlete.state.RunState;
import com.eainde.athlete.state.TopicDomain;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Refers the user to a human authority.
 * <p>
 * Target and urgency are chosen deterministically from the classification. Only the referral
 * prose comes from the model, and when that call fails (breaker open included) a fixed template
 * with the target's verified contacts is used instead, so this node always produces a referral.
 * Emergency-services wording appears only for {@link EscalationCategory#IMMINENT_DANGER}.
 */
@Slf4j
@Component
public class EscalateNode implements AsyncNodeAction<RunState> {

    static final String EMERGENCY_LINE = "**If you are in immediate danger, call 911 first.**";

    private static final Pattern EMERGENCY_WORDING = Pattern.compile("(?i)\\b911\\b|emergency services");

    private static final Map<TopicDomain, String> DOMAIN_HELP = new EnumMap<>(TopicDomain.class);

    static {
        DOMAIN_HELP.put(TopicDomain.SAFESPORT, "The U.S. Center for SafeSport can investigate reports of sexual, "
                + "emotional or physical misconduct, bullying, hazing and harassment. Reports can be made anonymously.");
        DOMAIN_HELP.put(TopicDomain.ATHLETE_SAFETY, "The U.S. Center for SafeSport handles reports of abuse and "
                + "misconduct that put athletes at risk.");
        DOMAIN_HELP.put(TopicDomain.ANTI_DOPING, "USADA can help with drug testing, Therapeutic Use Exemptions, "
                + "whereabouts requirements, prohibited substances and rule violation proceedings.");
        DOMAIN_HELP.put(TopicDomain.DISPUTE_RESOLUTION, "The Athlete Ombuds provides free, confidential advice on "
                + "disputes, including Section 9 arbitration and grievance procedures.");
        DOMAIN_HELP.put(TopicDomain.TEAM_SELECTION, "The Athlete Ombuds can explain your sport's selection "
                + "procedures and your options if you believe a selection decision was made in error.");
        DOMAIN_HELP.put(TopicDomain.ELIGIBILITY, "The Athlete Ombuds can advise on eligibility requirements for "
                + "your sport and competition level.");
        DOMAIN_HELP.put(TopicDomain.GOVERNANCE, "The Athletes' Commission and the Athlete Ombuds can assist with "
                + "governance concerns and athlete representation.");
        DOMAIN_HELP.put(TopicDomain.ATHLETE_RIGHTS, "The Athletes' Commission can help with athlete representation "
                + "and marketing rights; the Athlete Ombuds gives confidential guidance on rights disputes.");
    }

    private final LlmClient llmClient;
    private final PromptService promptService;
    private final EscalationDirectory directory;
    private final EmpathyTemplates empathy;

    public EscalateNode(LlmClient llmClient, PromptService promptService, EscalationDirectory directory,
                        EmpathyTemplates empathy) {
        this.llmClient = llmClient;
        this.promptService = promptService;
        this.directory = directory;
        this.empathy = empathy;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        TopicDomain domain = Optional.ofNullable(state.getTopicDomain()).orElse(TopicDomain.SAFESPORT);
        EscalationCategory category = state.getEscalationCategory();
        EscalationTarget target = directory.primaryFor(domain);
        EscalationUrgency urgency = urgency(domain, category, state.hasTimeConstraint());
        String reason = Optional.ofNullable(state.getEscalationReason()).filter(r -> !r.isBlank())
                .orElse("Question requires " + urgency.value() + " referral to " + target.organization()
                        + " for a " + domain.label().toLowerCase() + " matter");

        EscalationInfo escalation = new EscalationInfo(target.id(), target.organization(), target.email(),
                target.phone(), target.url(), reason, category, urgency);

        List<EscalationTarget> targets = directory.allFor(domain);
        String answer;
        try {
            answer = generateReferral(state, domain, category, urgency, targets);
            if (!answer.contains(target.primaryContact())) {
                answer = answer + "\n\n" + target.contactBlock();
            }
        } catch (RuntimeException e) {
            log.warn("Referral generation failed, using template for {}: {}", target.id(), e.getMessage());
            answer = templateReferral(state, domain, category, urgency, targets);
        }

        log.info("Escalation to {} (domain={}, urgency={}, category={})",
                target.id(), domain.value(), urgency.value(), category);
        return CompletableFuture.completedFuture(Map.of(
                RunState.ESCALATION, escalation,
                RunState.ANSWER, answer));
    }

    static EscalationUrgency urgency(TopicDomain domain, EscalationCategory category, boolean timeConstraint) {
        if (domain.isSafetyCritical() || timeConstraint || category == EscalationCategory.IMMINENT_DANGER) {
            return EscalationUrgency.IMMEDIATE;
        }
        return EscalationUrgency.STANDARD;
    }

    private String generateReferral(RunState state, TopicDomain domain, EscalationCategory category,
                                    EscalationUrgency urgency, List<EscalationTarget> targets) {
        String contacts = targets.stream().map(EscalationTarget::contactBlock).collect(Collectors.joining("\n"));
        String system = promptService.render("escalation", Map.of(
                "domain", domain.label(),
                "urgency", urgency.value(),
                "category", category == null ? "unspecified" : category.value(),
                "emergency", category == EscalationCategory.IMMINENT_DANGER
                        ? "The user may be in immediate physical danger. Tell them to call 911 first."
                        : "Do not mention emergency services or 911.",
                "contacts", contacts,
                "tone", empathy.toneGuidance(state.getEmotionalState())));
        String text = llmClient.invoke(ModelRole.ESCALATION,
                List.of(SystemMessage.from(system), UserMessage.from(state.getCurrentQuestion())));
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("empty referral text");
        }
        if (category != EscalationCategory.IMMINENT_DANGER && EMERGENCY_WORDING.matcher(text).find()) {
            throw new IllegalStateException("referral mentions emergency services for a non-imminent matter");
        }
        return text.trim();
    }

    String templateReferral(RunState state, TopicDomain domain, EscalationCategory category,
                            EscalationUrgency urgency, List<EscalationTarget> targets) {
        StringBuilder answer = new StringBuilder();
        if (category == EscalationCategory.IMMINENT_DANGER) {
            answer.append(EMERGENCY_LINE).append("\n\n");
        }
        if (urgency == EscalationUrgency.IMMEDIATE) {
            answer.append("Your situation needs prompt attention from the right authority. I can't investigate "
                    + "or resolve it myself, but these contacts can help you directly.\n\n");
        } else {
            answer.append("Your question is best handled by a specialized authority. I recommend reaching out "
                    + "to the following for personal guidance.\n\n");
        }
        answer.append("## Recommended Contact(s)\n\n");
        for (EscalationTarget target : targets) {
            answer.append(target.contactBlock()).append('\n');
        }
        String help = DOMAIN_HELP.get(domain);
        if (help != null) {
            answer.append("## What They Can Help With\n\n").append(help);
        }
        return empathy.withPreamble(answer.toString().trim(), state.getEmotionalState());
    }
}
