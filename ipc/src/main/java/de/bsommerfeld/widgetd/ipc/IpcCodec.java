package de.bsommerfeld.widgetd.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Line-oriented JSON framing shared by {@link CommandServer} and
 * {@link IpcClient}. One message per line, no pretty printing.
 */
public final class IpcCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private IpcCodec() {
    }

    public static String encode(Object message) {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + message, e);
        }
    }

    public static IpcRequest decodeRequest(String line) throws JsonProcessingException {
        IpcRequest request = MAPPER.readValue(line, IpcRequest.class);
        if (request.action() == null || request.action().isBlank()) {
            throw new IllegalArgumentException("Request has no action");
        }
        return request;
    }

    public static IpcResponse decodeResponse(String line) throws JsonProcessingException {
        return MAPPER.readValue(line, IpcResponse.class);
    }
}
