package com.eainde.athlete.knowledge;

import com.eainde.athlete.state.TopicDomain;

import java.util.Set;

/**
 * A verified referral destination. Contact fields may be null when the organization does not
 * publish that channel.
 */
public record EscalationTarget(
        String id,
        String organization,
        String email,
        String phone,
        String url,
        Set<TopicDomain> domains,
        String description) {

    /** One line per available contact channel, used in fallback referrals. */
    public String contactBlock() {
        StringBuilder block = new StringBuilder("**").append(organization).append("**\n");
        if (phone != null) {
            block.append("- Phone: ").append(phone).append('\n');
        }
        if (email != null) {
            block.append("- Email: ").append(email).append('\n');
        }
        if (url != null) {
            block.append("- Website: ").append(url).append('\n');
        }
        return block.toString();
    }

    /** The contact string a referral to this target must contain. */
    public String primaryContact() {
        if (phone != null) {
            return phone;
        }
        return email != null ? email : url;
    }
}
