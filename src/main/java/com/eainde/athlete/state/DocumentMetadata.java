package com.eainde.athlete.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * Metadata stored alongside each indexed chunk. Any field may be null.
 *
 * @param documentTitle   title of the source document
 * @param sectionTitle    heading the chunk sits under
 * @param sourceUrl       where the document was fetched from
 * @param documentType    bylaws, policy, procedure, ...
 * @param ngbId           owning organization, null for documents that apply to everyone
 * @param topicDomain     wire value of the {@link TopicDomain}
 * @param authorityLevel  precedence label, e.g. {@code law}, {@code usopc_policy}
 * @param effectiveDate   ISO date the document took effect
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentMetadata(
        String documentTitle,
        String sectionTitle,
        String sourceUrl,
        String documentType,
        String ngbId,
        String topicDomain,
        String authorityLevel,
        String effectiveDate) implements Serializable {

    public static DocumentMetadata empty() {
        return new DocumentMetadata(null, null, null, null, null, null, null, null);
    }
}
