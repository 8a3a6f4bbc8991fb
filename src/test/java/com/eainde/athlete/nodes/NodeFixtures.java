package com.eainde.athlete.nodes;

import com.eainde.athlete.state.ConversationMessage;
import com.eainde.athlete.state.DocumentMetadata;
import com.eainde.athlete.state.RetrievedDocument;
import com.eainde.athlete.state.RunState;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Shared builders for node tests. */
final class NodeFixtures {

    private NodeFixtures() {
    }

    static RunState state(String question, Object... keyValues) {
        Map<String, Object> data = new HashMap<>();
        data.put(RunState.MESSAGES, List.of(ConversationMessage.user(question)));
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new RunState(data);
    }

    static RetrievedDocument document(String id, String title, String section, String content, Double distance) {
        DocumentMetadata metadata = new DocumentMetadata(title, section, "https://docs.example/" + id, "policy",
                null, "team_selection", "ngb_policy", "2024-01-01");
        return new RetrievedDocument(id, content, metadata, 0.01, distance);
    }
}
