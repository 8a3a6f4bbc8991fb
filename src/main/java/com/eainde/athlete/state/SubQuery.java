package com.eainde.athlete.state;

import java.io.Serializable;
import java.util.List;

/**
 * One focused part of a multi-part question.
 *
 * @param query           the search text
 * @param domain          domain to filter on, null for any
 * @param organizationIds organizations to filter on, empty for any
 */
public record SubQuery(String query, TopicDomain domain, List<String> organizationIds) implements Serializable {
}
