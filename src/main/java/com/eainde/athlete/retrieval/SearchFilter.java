package com.eainde.athlete.retrieval;

import com.eainde.athlete.state.TopicDomain;

import java.util.List;

/**
 * Restricts a search to organizations and a topic domain.
 *
 * @param organizationIds  organizations to match, empty for no restriction
 * @param domain           topic domain to match, null for any
 * @param includeUniversal also match documents that belong to no organization
 */
public record SearchFilter(List<String> organizationIds, TopicDomain domain, boolean includeUniversal) {

    public SearchFilter {
        organizationIds = organizationIds == null ? List.of() : List.copyOf(organizationIds);
    }

    public static SearchFilter none() {
        return new SearchFilter(List.of(), null, true);
    }

    public static SearchFilter narrow(List<String> organizationIds, TopicDomain domain) {
        return new SearchFilter(organizationIds, domain, false);
    }

    /** Organization documents plus universal ones, any domain. */
    public static SearchFilter broaden(List<String> organizationIds) {
        return new SearchFilter(organizationIds, null, true);
    }
}
