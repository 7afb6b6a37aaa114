package io.engram.core.consolidation;

import io.engram.core.lifecycle.PendingMemory;
import java.util.ArrayList;
import java.util.List;

public final class ConsolidationPromptBuilder {
    static final int PREVIEW_CHARS = 100;

    public String build(List<PendingMemory> batch) {
        return """
            You are reviewing %d memories from working memory (expired TTL).

            For each memory, decide:
            - IMPORTANT: Promote to long-term (key learnings, decisions, insights needed for future)
            - CONTEXT: Extend to short-term (ongoing projects, might need soon, review in 7 days)
            - ARCHIVE: Move to archive (completed tasks, historical records worth keeping)
            - FORGET: Delete (trivial actions, noise, redundant information)

            Consider whether the information is needed for future decisions, whether it represents
            growth or learning, whether it is unique, and whether it has lasting value.

            Memories to review:
            %s

            Return ONLY a JSON array with exactly one object per memory, no other text:
            [
              {"id": 1, "decision": "important", "reason": "Key learning about content strategy"},
              {"id": 2, "decision": "forget", "reason": "Routine command execution"}
            ]

            "id" is the memory's number in the list above. Decisions must be: important, context, archive, or forget.
            """.formatted(batch.size(), lines(batch));
    }

    String lines(List<PendingMemory> batch) {
        List<String> lines = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            lines.add(line(i + 1, batch.get(i)));
        }
        return String.join("\n", lines);
    }

    static String line(int ordinal, PendingMemory memory) {
        String details = memory.details() == null ? "" : memory.details();
        String preview = details.length() > PREVIEW_CHARS ? details.substring(0, PREVIEW_CHARS) + "..." : details;
        return ordinal + ". [" + memory.domain().wireName() + "] " + preview;
    }
}
