package org.deepsymmetry.voicelink.stream;

import com.fasterxml.jackson.databind.JsonNode;
import org.apiguardian.api.API;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A message envelope exchanged with a device in a text frame: a type tag, optional type-dependent data, and
 * the time it was sent. Messages are immutable.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class Message {

    /**
     * Defines all the message types we know how to handle.
     */
    public enum KnownType {
        /**
         * A liveness check, which must be answered with a {@link #PONG}.
         */
        PING("ping"),
        /**
         * The answer to a {@link #PING}.
         */
        PONG("pong"),
        /**
         * The device has recognized a speaker in the audio it was sent.
         */
        RECOGNITION_RESULT("recognition_result"),
        /**
         * The device is reporting a problem. This does not close the connection.
         */
        ERROR("error");

        /**
         * The type tag used for this kind of message on the wire.
         */
        public final String protocolValue;

        KnownType(String protocolValue) {
            this.protocolValue = protocolValue;
        }
    }

    /**
     * Allows a known message type to be looked up by its type tag.
     */
    public static final Map<String, KnownType> KNOWN_TYPE_MAP;

    static {
        Map<String, KnownType> scratch = new HashMap<>();
        for (KnownType type : KnownType.values()) {
            scratch.put(type.protocolValue, type);
        }
        KNOWN_TYPE_MAP = Collections.unmodifiableMap(scratch);
    }

    /**
     * The type tag of the message, as it appears on the wire. Never {@code null}.
     */
    @API(status = API.Status.STABLE)
    public final String type;

    /**
     * The type-dependent content of the message, or {@code null} if there was none.
     */
    @API(status = API.Status.STABLE)
    public final JsonNode data;

    /**
     * When the message was sent, or {@code null} if the sender did not say, or said it in a way we could not
     * understand.
     */
    @API(status = API.Status.STABLE)
    public final Instant timestamp;

    /**
     * The recognized type of the message, or {@code null} if the type tag is not one we know.
     */
    @API(status = API.Status.STABLE)
    public final KnownType knownType;

    /**
     * Constructor sets all the immutable fields.
     *
     * @param type the type tag of the message
     * @param data the content of the message, may be {@code null}
     * @param timestamp when the message was sent, may be {@code null}
     *
     * @throws IllegalArgumentException if {@code type} is {@code null} or blank
     */
    @API(status = API.Status.STABLE)
    public Message(String type, JsonNode data, Instant timestamp) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Messages must have a type");
        }
        this.type = type;
        this.data = data;
        this.timestamp = timestamp;
        knownType = KNOWN_TYPE_MAP.get(type.toLowerCase(Locale.ROOT));
    }

    /**
     * Create a message of a known type with no content, stamped with the current time.
     *
     * @param type the kind of message to create
     *
     * @return the new message
     */
    @API(status = API.Status.STABLE)
    public static Message of(KnownType type) {
        return new Message(type.protocolValue, null, Instant.now());
    }

    @Override
    public String toString() {
        return "Message[type:" + type + ", data:" + data + ", timestamp:" + timestamp + "]";
    }
}
