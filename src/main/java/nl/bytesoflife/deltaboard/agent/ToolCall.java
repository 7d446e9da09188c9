package nl.bytesoflife.deltaboard.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One logged tool invocation with the arguments as they were after validation.
 */
public record ToolCall(String toolName, ObjectNode args, JsonNode result) {
}
