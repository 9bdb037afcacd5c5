package io.itemapi.server.core;

import io.itemapi.core.Protocol;
import io.itemapi.json.spi.JsonCodec;
import io.itemapi.json.spi.JsonException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Framework-neutral response abstraction.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    /**
     * JSON-encoded {@code value} with {@code Content-Type: application/json}.
     */
    public static ServerResponse json(int status, JsonCodec codec, Object value) throws JsonException {
        return new ServerResponse(status, new ResponseBody.Bytes(codec.writeBytes(value)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
    }

    /**
     * Short plaintext body, used for every error status.
     */
    public static ServerResponse text(int status, String message) {
        byte[] bytes = (message + "\n").getBytes(StandardCharsets.UTF_8);
        return new ServerResponse(status, new ResponseBody.Bytes(bytes))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_TEXT);
    }

    public static ServerResponse noContent() {
        return new ServerResponse(204, new ResponseBody.Empty());
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    /**
     * First value of a header, matched case-insensitively.
     */
    public String firstHeader(String name) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return e.getValue().get(0);
            }
        }
        return null;
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    /**
     * Same status and headers with a different body.
     */
    public ServerResponse withBody(ResponseBody newBody) {
        ServerResponse copy = new ServerResponse(status, newBody);
        headers.forEach((name, values) -> values.forEach(v -> copy.header(name, v)));
        return copy;
    }
}
