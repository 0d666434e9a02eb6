package org.deepsymmetry.voicelink.stream;

import org.apiguardian.api.API;

import java.nio.ByteBuffer;

/**
 * Receives what arrives on a {@link Transport}. Events for a single transport are delivered one at a time,
 * in the order they happened.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public interface TransportListener {

    /**
     * A complete text frame has arrived.
     *
     * @param text the content of the frame
     */
    void textReceived(String text);

    /**
     * A complete binary frame has arrived.
     *
     * @param data the content of the frame
     */
    void binaryReceived(ByteBuffer data);

    /**
     * The connection has closed. Once this has been called, no further events are delivered.
     *
     * @param code the close status code
     * @param reason the reason given for closing, may be empty
     * @param clean {@code true} if the close was started by our side through {@link Transport#close(int, String)}
     */
    void closed(int code, String reason, boolean clean);

    /**
     * The connection has failed. Once this has been called, no further events are delivered.
     *
     * @param cause what went wrong
     */
    void failed(Throwable cause);
}
