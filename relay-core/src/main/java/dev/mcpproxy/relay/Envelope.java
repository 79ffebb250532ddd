package dev.mcpproxy.relay;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A single JSON-RPC 2.0 message. The body is kept as a JSON tree so that members the relay does
 * not know about pass through untouched.
 */
public record Envelope(ObjectNode body) {

    public static final String JSONRPC_VERSION = "2.0";

    public static final String METHOD_CANCELLED = "notifications/cancelled";

    public static final int PARSE_ERROR = -32700;

    public Envelope {
        Objects.requireNonNull(body, "body");
    }

    /**
     * @return the request id, or {@code null} when the message carries none
     */
    public JsonNode id() {
        return body.get("id");
    }

    /**
     * @return the method name, or {@code null} for responses
     */
    public String method() {
        JsonNode method = body.get("method");
        return method != null && method.isTextual() ? method.textValue() : null;
    }

    public boolean isRequest() {
        return method() != null && body.has("id");
    }

    public boolean isNotification() {
        return method() != null && !body.has("id");
    }

    public boolean isResponse() {
        return method() == null && (body.has("result") || body.has("error"));
    }

    public static Envelope notification(String method, ObjectNode params) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("jsonrpc", JSONRPC_VERSION);
        body.put("method", method);
        if (params != null) {
            body.set("params", params);
        }
        return new Envelope(body);
    }

    /**
     * Build the notification sent to a session that is being replaced by a newer one.
     * @param reason human-readable explanation placed in {@code params.reason}
     */
    public static Envelope cancelled(String reason) {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("reason", reason);
        return notification(METHOD_CANCELLED, params);
    }

    public static Envelope error(JsonNode id, int code, String message) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("jsonrpc", JSONRPC_VERSION);
        body.set("id", id == null ? JsonNodeFactory.instance.nullNode() : id);
        ObjectNode error = body.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return new Envelope(body);
    }
}
