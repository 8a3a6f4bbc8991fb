package com.eainde.athlete.knowledge;

import com.eainde.athlete.state.TopicDomain;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The verified referral targets and the domain-to-target mapping used by the escalate node.
 */
@Component
public class EscalationDirectory {

    public static final String ATHLETE_OMBUDS = "athlete_ombuds";
    public static final String SAFESPORT_CENTER = "safesport_center";
    public static final String USADA = "usada";
    public static final String ATHLETES_COMMISSION = "athletes_commission";
    public static final String CAS = "cas";
    public static final String EMERGENCY_SERVICES = "emergency_services";

    private final Map<String, EscalationTarget> targets = new LinkedHashMap<>();

    public EscalationDirectory() {
        register(new EscalationTarget(ATHLETE_OMBUDS, "Athlete Ombuds",
                "ombudsman@usathlete.org", "719-866-5000", "https://www.usathlete.org",
                EnumSet.of(TopicDomain.DISPUTE_RESOLUTION, TopicDomain.TEAM_SELECTION, TopicDomain.ELIGIBILITY,
                        TopicDomain.GOVERNANCE, TopicDomain.ATHLETE_RIGHTS, TopicDomain.FINANCIAL_ASSISTANCE),
                "Free, confidential, independent advice on athlete rights, disputes and grievances."));
        register(new EscalationTarget(SAFESPORT_CENTER, "U.S. Center for SafeSport",
                null, "833-5US-SAFE (833-587-7233)", "https://uscenterforsafesport.org/report-a-concern/",
                EnumSet.of(TopicDomain.SAFESPORT, TopicDomain.ATHLETE_SAFETY),
                "Independent authority for reports of abuse and misconduct in sport. Reports can be anonymous."));
        register(new EscalationTarget(USADA, "U.S. Anti-Doping Agency (USADA)",
                null, "1-866-601-2632", "https://www.usada.org",
                EnumSet.of(TopicDomain.ANTI_DOPING),
                "Testing, Therapeutic Use Exemptions, whereabouts and rule-violation notices."));
        register(new EscalationTarget(ATHLETES_COMMISSION, "Team USA Athletes' Commission",
                "teamusa.ac@teamusa-ac.org", null, null,
                EnumSet.of(TopicDomain.GOVERNANCE, TopicDomain.ATHLETE_RIGHTS),
                "Athlete representation within the Olympic and Paralympic movement."));
        register(new EscalationTarget(CAS, "Court of Arbitration for Sport",
                null, null, "https://www.tas-cas.org",
                EnumSet.of(TopicDomain.DISPUTE_RESOLUTION),
                "International appeals for disputes beyond national procedures."));
        register(new EscalationTarget(EMERGENCY_SERVICES, "Emergency Services",
                null, "911", null, EnumSet.noneOf(TopicDomain.class),
                "Immediate physical danger only."));
    }

    public Optional<EscalationTarget> get(String id) {
        return Optional.ofNullable(targets.get(id));
    }

    /** Primary target for a domain. Unresolved domains go to the safety authority. */
    public EscalationTarget primaryFor(TopicDomain domain) {
        if (domain == null) {
            return targets.get(SAFESPORT_CENTER);
        }
        switch (domain) {
            case SAFESPORT:
            case ATHLETE_SAFETY:
                return targets.get(SAFESPORT_CENTER);
            case ANTI_DOPING:
                return targets.get(USADA);
            default:
                return targets.get(ATHLETE_OMBUDS);
        }
    }

    /** Every non-emergency target that serves the domain, primary first. */
    public List<EscalationTarget> allFor(TopicDomain domain) {
        EscalationTarget primary = primaryFor(domain);
        Set<EscalationTarget> ordered = new LinkedHashSet<>();
        ordered.add(primary);
        targets.values().stream()
                .filter(t -> domain != null && t.domains().contains(domain))
                .forEach(ordered::add);
        return List.copyOf(ordered);
    }

    private void register(EscalationTarget target) {
        targets.put(target.id(), target);
    }
}
