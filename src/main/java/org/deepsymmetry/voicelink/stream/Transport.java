package org.deepsymmetry.voicelink.stream;

import org.apiguardian.api.API;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;

/**
 * An open streaming connection to a device, able to carry text and binary frames. Only one send may be
 * outstanding at a time; callers must wait for each returned future before starting the next send.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public interface Transport {

    /**
     * Send a complete text frame.
     *
     * @param text the content of the frame
     *
     * @return a future which completes when the frame has been handed to the network, or completes
     *         exceptionally if it could not be
     */
    CompletableFuture<?> sendText(String text);

    /**
     * Send a complete binary frame.
     *
     * @param data the content of the frame
     *
     * @return a future which completes when the frame has been handed to the network, or completes
     *         exceptionally if it could not be
     */
    CompletableFuture<?> sendBinary(ByteBuffer data);

    /**
     * Start a clean close of the connection. The {@link TransportListener#closed(int, String, boolean)}
     * event for a close started this way reports it as clean.
     *
     * @param code the close status code
     * @param reason a short description of why the connection is closing
     */
    void close(int code, String reason);

    /**
     * Drop the connection immediately, without any closing exchange.
     */
    void abort();
}
