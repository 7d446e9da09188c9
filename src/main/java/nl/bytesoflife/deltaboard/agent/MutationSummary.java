package nl.bytesoflife.deltaboard.agent;

import java.util.List;

/**
 * What an agent session committed. The three id lists are disjoint.
 */
public record MutationSummary(List<String> createdIds, List<String> updatedIds, List<String> deletedIds,
                              List<ToolCall> toolCalls) {

    public MutationSummary {
        createdIds = List.copyOf(createdIds);
        updatedIds = List.copyOf(updatedIds);
        deletedIds = List.copyOf(deletedIds);
        toolCalls = List.copyOf(toolCalls);
    }

    public boolean isEmpty() {
        return createdIds.isEmpty() && updatedIds.isEmpty() && deletedIds.isEmpty();
    }
}
