package com.eainde.athlete.state;

import java.io.Serializable;

/**
 * The referral produced by the escalate node.
 *
 * @param target       stable target id, e.g. {@code safesport_center}
 * @param organization human readable organization name
 * @param contactEmail verified email, may be null
 * @param contactPhone verified phone, may be null
 * @param contactUrl   verified url, may be null
 * @param reason       why the question was escalated
 * @param category     reason category, null when the classifier gave none
 * @param urgency      immediate or standard
 */
public record EscalationInfo(
        String target,
        String organization,
        String contactEmail,
        String contactPhone,
        String contactUrl,
        String reason,
        EscalationCategory category,
        EscalationUrgency urgency) implements Serializable {
}
