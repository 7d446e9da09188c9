package nl.bytesoflife.deltaboard.agent;

import com.fasterxml.jackson.databind.node.ObjectNode;
import nl.bytesoflife.deltaboard.store.BoardObjectJson;

/**
 * Builders for the JSON results handed back to the agent.
 */
final class ToolResults {

    static final String NOT_FOUND_MESSAGE = "Object not found";

    /**
     * Why a call did not apply.
     */
    enum FailureKind {
        NOT_FOUND,
        UNSUPPORTED_OPERATION
    }

    private ToolResults() {
    }

    static ObjectNode ok() {
        ObjectNode node = BoardObjectJson.MAPPER.createObjectNode();
        node.put("ok", true);
        return node;
    }

    static ObjectNode created(String id) {
        ObjectNode node = BoardObjectJson.MAPPER.createObjectNode();
        node.put("id", id);
        return node;
    }

    static ObjectNode notFound() {
        return failure(FailureKind.NOT_FOUND, NOT_FOUND_MESSAGE);
    }

    static ObjectNode unsupported(String reason) {
        return failure(FailureKind.UNSUPPORTED_OPERATION, reason);
    }

    static ObjectNode failure(FailureKind kind, String error) {
        ObjectNode node = BoardObjectJson.MAPPER.createObjectNode();
        node.put("ok", false);
        node.put("error", error);
        node.put("kind", kind.name());
        return node;
    }

    static boolean isOk(ObjectNode result) {
        return !result.has("ok") || result.get("ok").asBoolean(false);
    }
}
