package com.eainde.athlete.knowledge;

import com.eainde.athlete.state.EscalationCategory;
import com.eainde.athlete.state.TopicDomain;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Disclaimer appended to every generated answer, chosen by topic domain.
 */
@Component
public class Disclaimers {

    static final String GENERAL = "This information is for educational purposes only and does not constitute "
            + "legal advice. For personalized guidance, consult the Athlete Ombuds or qualified legal counsel.";

    static final String EMERGENCY_LINE = "If you are in immediate danger, call 911. ";

    private static final String SAFESPORT_REPORTING = "To report abuse or misconduct in sport, contact the "
            + "U.S. Center for SafeSport at https://uscenterforsafesport.org/report-a-concern/ or call "
            + "833-5US-SAFE (833-587-7233). Reports can be made anonymously.\n\n" + GENERAL;

    private final Map<TopicDomain, String> byDomain = new EnumMap<>(TopicDomain.class);

    public Disclaimers() {
        byDomain.put(TopicDomain.TEAM_SELECTION, GENERAL + "\n\nTeam selection procedures vary by sport and event. "
                + "Always refer to the specific NGB's published selection procedures for the competition in question. "
                + "If you believe a selection decision was made in error, contact the Athlete Ombuds at "
                + "ombudsman@usathlete.org or 719-866-5000 for guidance on your options.");
        byDomain.put(TopicDomain.DISPUTE_RESOLUTION, GENERAL + "\n\nFor assistance with disputes, including Section 9 "
                + "arbitration and grievance procedures, contact the Athlete Ombuds at ombudsman@usathlete.org or "
                + "719-866-5000. The Ombuds provides free, confidential, and independent advice to athletes.");
        byDomain.put(TopicDomain.ANTI_DOPING, GENERAL + "\n\nFor anti-doping questions, including Therapeutic Use "
                + "Exemptions, whereabouts requirements, or testing procedures, contact USADA at https://www.usada.org "
                + "or call 1-866-601-2632. If you have been notified of a potential anti-doping rule violation, "
                + "seek legal counsel immediately.");
        byDomain.put(TopicDomain.GOVERNANCE, GENERAL + "\n\nFor governance and representation concerns, contact the "
                + "Team USA Athletes' Commission at teamusa.ac@teamusa-ac.org or reach out to your NGB's athlete "
                + "representative.");
        byDomain.put(TopicDomain.ATHLETE_RIGHTS, GENERAL + "\n\nFor questions about athlete rights and representation, "
                + "contact the Team USA Athletes' Commission at teamusa.ac@teamusa-ac.org. For marketing and "
                + "sponsorship rights questions, the Athlete Ombuds can provide guidance at ombudsman@usathlete.org "
                + "or 719-866-5000.");
        byDomain.put(TopicDomain.ELIGIBILITY, GENERAL + "\n\nEligibility requirements vary by sport, competition level, "
                + "and governing body. Contact your NGB directly or the Athlete Ombuds at ombudsman@usathlete.org "
                + "for guidance specific to your situation.");
    }

    /**
     * @param domain   resolved domain, null for the general disclaimer
     * @param category escalation category; the emergency line is only included for imminent danger
     */
    public String forDomain(TopicDomain domain, EscalationCategory category) {
        if (domain == TopicDomain.SAFESPORT || domain == TopicDomain.ATHLETE_SAFETY) {
            String prefix = category == EscalationCategory.IMMINENT_DANGER ? EMERGENCY_LINE : "";
            return domain == TopicDomain.SAFESPORT ? prefix + SAFESPORT_REPORTING : prefix + GENERAL;
        }
        if (domain == null) {
            return GENERAL;
        }
        return byDomain.getOrDefault(domain, GENERAL);
    }
}
