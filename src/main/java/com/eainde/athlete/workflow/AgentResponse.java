package com.eainde.athlete.workflow;

import com.eainde.athlete.state.Citation;
import com.eainde.athlete.state.EscalationInfo;

import java.util.List;

/**
 * Result of a blocking run.
 *
 * @param runId      thread id the run was checkpointed under
 * @param domain     wire value of the resolved topic domain, null when unresolved
 * @param confidence retrieval confidence in [0, 1]
 */
public record AgentResponse(String runId, String answer, List<Citation> citations, EscalationInfo escalation,
                            String domain, double confidence) {
}
