package org.deepsymmetry.voicelink.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.deepsymmetry.voicelink.Util;

import java.time.Instant;

/**
 * Converts between {@link Message} objects and the JSON text of the frames that carry them, which look like
 * <code>{"type": "...", "data": ..., "timestamp": "..."}</code>. Only the type is required.
 *
 * @since 0.1.0
 */
public class MessageCodec {

    private static final ObjectMapper mapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /**
     * Produce the text of the frame which sends a message. Messages without a timestamp are stamped with
     * the current time.
     *
     * @param message the message to send
     *
     * @return the JSON text of the envelope
     */
    public static String encode(Message message) {
        final ObjectNode envelope = mapper.createObjectNode();
        envelope.put("type", message.type);
        if (message.data != null) {
            envelope.set("data", message.data);
        }
        envelope.put("timestamp", (message.timestamp == null ? Instant.now() : message.timestamp).toString());
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to encode " + message, e);
        }
    }

    /**
     * Interpret the text of a frame received from a device.
     *
     * @param text the content of the frame
     *
     * @return the message it carried
     *
     * @throws MessageFormatException if the text is not a JSON object with a non-empty string {@code type}
     */
    public static Message decode(String text) throws MessageFormatException {
        final JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MessageFormatException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageFormatException("Frame is not a JSON object");
        }
        final JsonNode type = root.get("type");
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new MessageFormatException("Frame has no message type");
        }
        JsonNode data = root.get("data");
        if (data != null && data.isNull()) {
            data = null;
        }
        final JsonNode timestamp = root.get("timestamp");
        return new Message(type.asText(), data, (timestamp != null && timestamp.isTextual()) ?
                Util.parseTimestamp(timestamp.asText()) : null);
    }

    /**
     * Extract the recognition result carried by a {@link Message.KnownType#RECOGNITION_RESULT} message. Some
     * device versions send the result as a JSON object, others as a string containing the JSON, and both are
     * accepted.
     *
     * @param message the message whose data is to be interpreted
     *
     * @return the recognition result
     *
     * @throws MessageFormatException if the message has no data or it does not describe a recognition result
     */
    public static RecognitionResult decodeRecognitionResult(Message message) throws MessageFormatException {
        JsonNode data = message.data;
        try {
            if (data != null && data.isTextual()) {
                data = mapper.readTree(data.asText());
            }
            if (data == null || !data.isObject()) {
                throw new MessageFormatException("Recognition result message has no result object");
            }
            return mapper.treeToValue(data, RecognitionResult.class);
        } catch (JsonProcessingException e) {
            throw new MessageFormatException("Unable to interpret recognition result", e);
        }
    }

    /**
     * Find the description of the problem in an {@link Message.KnownType#ERROR} message, which may be the data
     * itself or its {@code message} field.
     *
     * @param message the error message
     *
     * @return the description reported by the device, or {@code "Unknown error"} if it did not give one
     */
    public static String errorText(Message message) {
        final JsonNode data = message.data;
        if (data != null) {
            if (data.isTextual() && !data.asText().isBlank()) {
                return data.asText();
            }
            if (data.isObject()) {
                for (String field : new String[] {"message", "error", "detail"}) {
                    final JsonNode text = data.get(field);
                    if (text != null && text.isTextual() && !text.asText().isBlank()) {
                        return text.asText();
                    }
                }
            }
        }
        return "Unknown error";
    }

    /**
     * Prevent instantiation.
     */
    private MessageCodec() {
        // Nothing to do.
    }
}
