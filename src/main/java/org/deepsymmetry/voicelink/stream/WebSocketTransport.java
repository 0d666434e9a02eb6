package org.deepsymmetry.voicelink.stream;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Carries the streaming connection over a WebSocket, using the HTTP client built into the JDK.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class WebSocketTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketTransport.class);

    /**
     * How many milliseconds we wait for the device to acknowledge our close before dropping the connection.
     */
    private static final long CLOSE_GRACE_PERIOD = 2000;

    /**
     * Opens WebSocket transports.
     */
    @API(status = API.Status.STABLE)
    public static class Factory implements TransportFactory {

        private final HttpClient client;

        /**
         * Create a factory with its own HTTP client.
         */
        public Factory() {
            this(HttpClient.newHttpClient());
        }

        /**
         * Create a factory which opens connections through a particular HTTP client.
         *
         * @param client the client to use
         */
        public Factory(HttpClient client) {
            this.client = client;
        }

        @Override
        public CompletableFuture<Transport> open(URI uri, Duration connectTimeout, TransportListener listener) {
            final Receiver receiver = new Receiver(listener);
            return client.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, receiver)
                    .thenApply(webSocket -> new WebSocketTransport(webSocket, receiver));
        }
    }

    private final WebSocket webSocket;

    private final Receiver receiver;

    private WebSocketTransport(WebSocket webSocket, Receiver receiver) {
        this.webSocket = webSocket;
        this.receiver = receiver;
    }

    @Override
    public CompletableFuture<?> sendText(String text) {
        return webSocket.sendText(text, true);
    }

    @Override
    public CompletableFuture<?> sendBinary(ByteBuffer data) {
        return webSocket.sendBinary(data, true);
    }

    @Override
    public void close(int code, String reason) {
        receiver.closeRequested.set(true);
        webSocket.sendClose(code, reason).whenComplete((ws, t) -> {
            if (t != null) {
                logger.debug("Unable to send close, dropping connection: {}", t.toString());
                webSocket.abort();
            }
        });
        CompletableFuture.delayedExecutor(CLOSE_GRACE_PERIOD, TimeUnit.MILLISECONDS).execute(() -> {
            if (!webSocket.isInputClosed()) {
                logger.debug("Close was not acknowledged, dropping connection.");
                webSocket.abort();
            }
        });
    }

    @Override
    public void abort() {
        receiver.closeRequested.set(true);
        webSocket.abort();
    }

    /**
     * Reassembles frames which arrive in parts and passes them on whole.
     */
    private static class Receiver implements WebSocket.Listener {

        private final TransportListener listener;

        /**
         * Set once our side has asked for the connection to close, which makes the close clean.
         */
        private final AtomicBoolean closeRequested = new AtomicBoolean(false);

        private final StringBuilder text = new StringBuilder();

        private final ByteArrayOutputStream binary = new ByteArrayOutputStream();

        Receiver(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                final String frame = text.toString();
                text.setLength(0);
                listener.textReceived(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            final byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            binary.write(bytes, 0, bytes.length);
            if (last) {
                final ByteBuffer frame = ByteBuffer.wrap(binary.toByteArray());
                binary.reset();
                listener.binaryReceived(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.closed(statusCode, reason, closeRequested.get());
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.failed(error);
        }
    }
}
