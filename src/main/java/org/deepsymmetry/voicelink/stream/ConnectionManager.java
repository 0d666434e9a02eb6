package org.deepsymmetry.voicelink.stream;

import org.apiguardian.api.API;
import org.deepsymmetry.voicelink.Device;
import org.deepsymmetry.voicelink.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * <p>Owns the streaming connection to a single device. Once connected, a heartbeat checks that the device is still
 * sending something, and pings it when it is; if the connection is lost without being asked to close, or the
 * device goes silent for too long, new connections are attempted to the same host and port a limited number of
 * times, with a fixed delay between attempts.</p>
 *
 * <p>Everything that happens is reported through {@link ConnectionListener} and {@link RecognitionListener}
 * events, which are delivered in order on a single background thread.</p>
 *
 * <p>The state of the connection is guarded by this object's monitor. Every new connection, reconnection sequence
 * and disconnection advances a generation counter, and background work started on behalf of an older generation
 * checks it before acting, so an explicit {@link #disconnect()} always wins over a reconnection that was underway.</p>
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class ConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    /**
     * The close status code which indicates an intentional, normal close.
     */
    public static final int NORMAL_CLOSURE = 1000;

    /**
     * The default path of the streaming endpoint on the device's service port.
     */
    public static final String DEFAULT_STREAM_PATH = "/ws/audio";

    /**
     * The default number of milliseconds a connection may take to open.
     */
    public static final int DEFAULT_CONNECTION_TIMEOUT = 10000;

    /**
     * The default number of times we try to restore a lost connection before giving up.
     */
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;

    /**
     * The default number of milliseconds between attempts to restore a lost connection.
     */
    public static final int DEFAULT_RECONNECT_DELAY = 5000;

    /**
     * The default number of milliseconds between heartbeats.
     */
    public static final int DEFAULT_HEARTBEAT_INTERVAL = 30000;

    /**
     * The default number of milliseconds without hearing anything from the device before it is considered dead.
     */
    public static final int DEFAULT_HEARTBEAT_TIMEOUT = 120000;

    /**
     * The default number of milliseconds a single send may take.
     */
    public static final int DEFAULT_SEND_TIMEOUT = 5000;

    private final AtomicInteger connectionTimeout = new AtomicInteger(DEFAULT_CONNECTION_TIMEOUT);

    private final AtomicInteger maxReconnectAttempts = new AtomicInteger(DEFAULT_MAX_RECONNECT_ATTEMPTS);

    private final AtomicInteger reconnectDelay = new AtomicInteger(DEFAULT_RECONNECT_DELAY);

    private final AtomicInteger heartbeatInterval = new AtomicInteger(DEFAULT_HEARTBEAT_INTERVAL);

    private final AtomicInteger heartbeatTimeout = new AtomicInteger(DEFAULT_HEARTBEAT_TIMEOUT);

    private final AtomicInteger sendTimeout = new AtomicInteger(DEFAULT_SEND_TIMEOUT);

    private final AtomicReference<String> streamPath = new AtomicReference<>(DEFAULT_STREAM_PATH);

    /**
     * Opens the connections.
     */
    private final TransportFactory transportFactory;

    /**
     * Runs heartbeats, reconnection attempts, and replies to pings.
     */
    private final ScheduledExecutorService scheduler = Util.newScheduler("VoiceLink connection", 2);

    /**
     * Delivers events to listeners, one at a time and in the order they happened.
     */
    private final ExecutorService eventDelivery = Util.newEventDeliveryExecutor("VoiceLink connection events");

    /**
     * Makes sure only one frame is being sent at a time.
     */
    private final Object sendLock = new Object();

    private final Set<ConnectionListener> connectionListeners = Collections.newSetFromMap(new ConcurrentHashMap<>());

    private final Set<RecognitionListener> recognitionListeners = Collections.newSetFromMap(new ConcurrentHashMap<>());

    private ConnectionState state = ConnectionState.DISCONNECTED;

    /**
     * Advanced whenever background work on behalf of the current connection should stop.
     */
    private long generation;

    private URI uri;

    private Device targetDevice;

    /**
     * The open connection, when {@link ConnectionState#CONNECTED}.
     */
    private Transport transport;

    /**
     * Receives the events of the open connection; events from any other handler are stale.
     */
    private Handler activeHandler;

    /**
     * Waits for a connection that is being opened, so that a disconnect can abandon it.
     */
    private CompletableFuture<Transport> pendingOpen;

    private ScheduledFuture<?> heartbeatTask;

    private ScheduledFuture<?> reconnectTask;

    private int reconnectAttempt;

    private volatile String lastError;

    /**
     * When we last heard anything at all from the device.
     */
    private volatile long lastHeartbeatAt;

    /**
     * Create a connection manager which connects to devices using WebSockets.
     */
    @API(status = API.Status.STABLE)
    public ConnectionManager() {
        this(new WebSocketTransport.Factory());
    }

    /**
     * Create a connection manager which opens its connections through a particular factory.
     *
     * @param transportFactory opens the connections
     *
     * @throws IllegalArgumentException if {@code transportFactory} is {@code null}
     */
    @API(status = API.Status.STABLE)
    public ConnectionManager(TransportFactory transportFactory) {
        if (transportFactory == null) {
            throw new IllegalArgumentException("transportFactory must not be null");
        }
        this.transportFactory = transportFactory;
    }

    /**
     * Set how long a connection may take to open before the attempt is abandoned.
     *
     * @param timeout the maximum number of milliseconds to wait
     *
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    public void setConnectionTimeout(int timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        connectionTimeout.set(timeout);
    }

    /**
     * Check how long a connection may take to open before the attempt is abandoned.
     *
     * @return the maximum number of milliseconds to wait
     */
    public int getConnectionTimeout() {
        return connectionTimeout.get();
    }

    /**
     * Set how many times we try to restore a lost connection before giving up. Zero means a lost connection
     * is not restored at all.
     *
     * @param attempts the maximum number of reconnection attempts
     *
     * @throws IllegalArgumentException if {@code attempts} is negative
     */
    public void setMaxReconnectAttempts(int attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative");
        }
        maxReconnectAttempts.set(attempts);
    }

    /**
     * Check how many times we try to restore a lost connection before giving up.
     *
     * @return the maximum number of reconnection attempts
     */
    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts.get();
    }

    /**
     * Set how long we wait before each attempt to restore a lost connection.
     *
     * @param delay the number of milliseconds to wait
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    public void setReconnectDelay(int delay) {
        if (delay < 0) {
            throw new IllegalArgumentException("delay cannot be negative");
        }
        reconnectDelay.set(delay);
    }

    /**
     * Check how long we wait before each attempt to restore a lost connection.
     *
     * @return the number of milliseconds to wait
     */
    public int getReconnectDelay() {
        return reconnectDelay.get();
    }

    /**
     * Set how often the heartbeat runs. Takes effect on the next connection.
     *
     * @param interval the number of milliseconds between heartbeats
     *
     * @throws IllegalArgumentException if {@code interval} is not positive, or not shorter than the heartbeat timeout
     */
    public void setHeartbeatInterval(int interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (interval >= heartbeatTimeout.get()) {
            throw new IllegalArgumentException("interval must be shorter than the heartbeat timeout");
        }
        heartbeatInterval.set(interval);
    }

    /**
     * Check how often the heartbeat runs.
     *
     * @return the number of milliseconds between heartbeats
     */
    public int getHeartbeatInterval() {
        return heartbeatInterval.get();
    }

    /**
     * Set how long the device may go without sending anything before the heartbeat considers it dead and
     * starts reconnecting.
     *
     * @param timeout the number of milliseconds of silence allowed
     *
     * @throws IllegalArgumentException if {@code timeout} is not longer than the heartbeat interval
     */
    public void setHeartbeatTimeout(int timeout) {
        if (timeout <= heartbeatInterval.get()) {
            throw new IllegalArgumentException("timeout must be longer than the heartbeat interval");
        }
        heartbeatTimeout.set(timeout);
    }

    /**
     * Check how long the device may go without sending anything before it is considered dead.
     *
     * @return the number of milliseconds of silence allowed
     */
    public int getHeartbeatTimeout() {
        return heartbeatTimeout.get();
    }

    /**
     * Set how long a single send may take before it is reported as failed.
     *
     * @param timeout the maximum number of milliseconds to wait
     *
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    public void setSendTimeout(int timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        sendTimeout.set(timeout);
    }

    /**
     * Check how long a single send may take before it is reported as failed.
     *
     * @return the maximum number of milliseconds to wait
     */
    public int getSendTimeout() {
        return sendTimeout.get();
    }

    /**
     * Set the path of the streaming endpoint on the device's port. Takes effect on the next call to
     * {@link #connect(String, int)}.
     *
     * @param path the path, which must start with a slash
     *
     * @throws IllegalArgumentException if {@code path} is {@code null} or does not start with a slash
     */
    public void setStreamPath(String path) {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with /");
        }
        streamPath.set(path);
    }

    /**
     * Check the path of the streaming endpoint on the device's port.
     *
     * @return the path
     */
    public String getStreamPath() {
        return streamPath.get();
    }

    /**
     * Get the current state of the connection.
     *
     * @return the state
     */
    @API(status = API.Status.STABLE)
    public synchronized ConnectionState getState() {
        return state;
    }

    /**
     * Check whether frames can currently be sent.
     *
     * @return {@code true} if the connection is open
     */
    @API(status = API.Status.STABLE)
    public synchronized boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * Get the device to which we most recently connected through {@link #connect(Device)}.
     *
     * @return the device, or {@code null} if the last connection was made by host and port
     */
    @API(status = API.Status.STABLE)
    public synchronized Device getTargetDevice() {
        return targetDevice;
    }

    /**
     * Get the streaming endpoint to which we most recently tried to connect.
     *
     * @return the endpoint, or {@code null} if no connection has been requested
     */
    public synchronized URI getUri() {
        return uri;
    }

    /**
     * Get the description of the most recent problem: why a connection failed or was lost, or the last error
     * reported by the device.
     *
     * @return the description, or {@code null} if there has been no problem since the last connection request
     */
    @API(status = API.Status.STABLE)
    public String getLastError() {
        return lastError;
    }

    /**
     * Get the time at which we last heard anything from the device.
     *
     * @return the millisecond timestamp of the last frame received or the connection opening, or zero
     */
    @API(status = API.Status.STABLE)
    public long getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    /**
     * Get the number of reconnection attempts made since the last explicit connection, or since the device was
     * last heard from over a restored connection.
     *
     * @return the attempt count, or zero if the connection has not been lost since then
     */
    @API(status = API.Status.STABLE)
    public synchronized int getReconnectAttempt() {
        return reconnectAttempt;
    }

    /**
     * Connect to a device that was found by discovery.
     *
     * @param device the device to connect to
     *
     * @return {@code true} if the connection opened within the connection timeout
     */
    @API(status = API.Status.STABLE)
    public boolean connect(Device device) {
        if (device == null) {
            throw new IllegalArgumentException("device must not be null");
        }
        return connectTo(device.getAddress().getHostAddress(), device.getPort(), device);
    }

    /**
     * Connect to the streaming endpoint of a device. Any existing connection is closed first. Blocks only until
     * the connection has opened or failed; when it fails, {@link #getLastError()} describes why and the manager
     * is left {@link ConnectionState#DISCONNECTED}.
     *
     * @param host the host name or address of the device
     * @param port the service port of the device
     *
     * @return {@code true} if the connection opened within the connection timeout
     *
     * @throws IllegalArgumentException if the host is missing or the port is out of range
     */
    @API(status = API.Status.STABLE)
    public boolean connect(String host, int port) {
        return connectTo(host, port, null);
    }

    private boolean connectTo(String host, int port, Device device) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535, got " + port);
        }
        final URI target = streamUri(host.trim(), port);
        final long gen;
        synchronized (this) {
            if (state != ConnectionState.DISCONNECTED) {
                logger.info("Closing connection to {} before connecting to {}", uri, target);
                tearDown("Connecting elsewhere");
            }
            uri = target;
            targetDevice = device;
            reconnectAttempt = 0;
            lastError = null;
            generation++;
            gen = generation;
            setState(ConnectionState.CONNECTING);
        }
        return establish(gen, ConnectionState.CONNECTING);
    }

    /**
     * Build the streaming endpoint address for a device. Port 443 means the device is behind TLS.
     *
     * @param host the host name or address of the device
     * @param port the service port of the device
     *
     * @return the endpoint address
     */
    private URI streamUri(String host, int port) {
        try {
            return new URI(port == 443 ? "wss" : "ws", null, host, port, streamPath.get(), null, null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Unable to build streaming address for " + host + ":" + port, e);
        }
    }

    /**
     * Open a connection and wait for it, then adopt it if nothing else has happened in the meantime.
     *
     * @param gen the generation on whose behalf the connection is being opened
     * @param expected the state we must still be in for the connection to be used
     *
     * @return {@code true} if the connection was opened and adopted
     */
    private boolean establish(long gen, ConnectionState expected) {
        final Handler handler = new Handler(gen);
        final CompletableFuture<Transport> waiter = new CompletableFuture<>();
        final URI target;
        final int timeout = connectionTimeout.get();
        synchronized (this) {
            if (gen != generation || state != expected) {
                return false;
            }
            target = uri;
            pendingOpen = waiter;
        }
        logger.info("Connecting to {}", target);
        try {
            transportFactory.open(target, Duration.ofMillis(timeout), handler).whenComplete((created, t) -> {
                if (t != null) {
                    waiter.completeExceptionally(t);
                } else if (!waiter.complete(created)) {
                    logger.debug("Dropping connection to {} which opened too late", target);
                    created.abort();
                }
            });
        } catch (RuntimeException e) {
            waiter.completeExceptionally(e);
        }

        Transport opened = null;
        Throwable failure = null;
        try {
            opened = waiter.get(timeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            failure = new TimeoutException("Timed out after " + timeout + " ms");
        } catch (ExecutionException e) {
            failure = e.getCause();
        } catch (CancellationException e) {
            failure = e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        }
        if (opened == null && !waiter.cancel(false) && !waiter.isCompletedExceptionally()) {
            waiter.join().abort();  // Opened just as we gave up on it.
        }

        synchronized (this) {
            if (pendingOpen == waiter) {
                pendingOpen = null;
            }
            if (gen != generation) {
                logger.debug("Connection attempt to {} was superseded", target);
                if (opened != null) {
                    opened.abort();
                }
                return false;
            }
            if (opened == null || handler.closedEarly) {
                if (opened != null) {
                    opened.abort();
                    failure = new IOException("Connection closed as soon as it opened");
                }
                connectFailed(target, failure);
                return false;
            }
            transport = opened;
            activeHandler = handler;
            lastHeartbeatAt = System.currentTimeMillis();
            setState(ConnectionState.CONNECTED);
            startHeartbeat();
        }
        logger.info("Connected to {}", target);
        return true;
    }

    /**
     * Record and report a failed connection attempt. A failed first attempt leaves us disconnected; during
     * reconnection, the reconnection sequence decides what happens next.
     *
     * @param target the endpoint we were trying to reach
     * @param cause what went wrong
     */
    private synchronized void connectFailed(URI target, Throwable cause) {
        final String message = "Unable to connect to " + target + ": " + describe(cause);
        logger.warn(message);
        lastError = message;
        deliverError(message, cause);
        if (state == ConnectionState.CONNECTING) {
            setState(ConnectionState.DISCONNECTED);
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown problem";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    /**
     * Close the connection, stop the heartbeat, and abandon any connection or reconnection in progress.
     * Does nothing if already disconnected.
     */
    @API(status = API.Status.STABLE)
    public synchronized void disconnect() {
        if (state == ConnectionState.DISCONNECTED) {
            logger.debug("Already disconnected.");
            return;
        }
        logger.info("Disconnecting from {}", uri);
        tearDown("Client disconnect");
    }

    /**
     * Shut everything down and settle in {@link ConnectionState#DISCONNECTED}. Must be called while holding
     * the lock.
     *
     * @param reason sent to the device as the close reason
     */
    private void tearDown(String reason) {
        generation++;
        setState(ConnectionState.DISCONNECTING);
        stopHeartbeat();
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
        if (pendingOpen != null) {
            pendingOpen.cancel(false);
            pendingOpen = null;
        }
        activeHandler = null;
        if (transport != null) {
            final Transport closing = transport;
            transport = null;
            try {
                closing.close(NORMAL_CLOSURE, reason);
            } catch (RuntimeException e) {
                logger.debug("Problem closing connection, dropping it instead", e);
                closing.abort();
            }
        }
        reconnectAttempt = 0;
        setState(ConnectionState.DISCONNECTED);
    }

    /**
     * Must be called while holding the lock.
     */
    private void startHeartbeat() {
        final long gen = generation;
        final long interval = heartbeatInterval.get();
        heartbeatTask = scheduler.scheduleWithFixedDelay(() -> heartbeat(gen), interval, interval, TimeUnit.MILLISECONDS);
    }

    /**
     * Must be called while holding the lock.
     */
    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    /**
     * Check that the device is still alive. If we have not heard from it for too long, start reconnecting
     * rather than waiting for the network to notice; otherwise ping it.
     *
     * @param gen the generation of the connection the heartbeat was started for
     */
    private void heartbeat(long gen) {
        synchronized (this) {
            if (gen != generation || state != ConnectionState.CONNECTED) {
                return;
            }
            final long silence = System.currentTimeMillis() - lastHeartbeatAt;
            if (silence > heartbeatTimeout.get()) {
                beginReconnect("Nothing heard from device for " + silence + " ms", null);
                return;
            }
        }
        try {
            sendMessage(Message.of(Message.KnownType.PING));
        } catch (IOException | IllegalStateException e) {
            logger.debug("Unable to send heartbeat ping: {}", e.toString());
        }
    }

    /**
     * The connection has been lost without being asked to close. Drop it and start trying to restore it, unless
     * the attempts allowed since the last explicit connection, or since the device was last heard from, have
     * already been used up by a connection that keeps dropping. Must be called while holding the lock.
     *
     * @param reason a description of how the connection was lost
     * @param cause the exception that reported the loss, if any
     */
    private void beginReconnect(String reason, Throwable cause) {
        logger.warn("Connection to {} lost: {}", uri, reason);
        lastError = reason;
        deliverError(reason, cause);
        generation++;
        stopHeartbeat();
        activeHandler = null;
        if (transport != null) {
            transport.abort();
            transport = null;
        }
        if (reconnectAttempt >= maxReconnectAttempts.get()) {
            logger.error("Giving up on {} after {} reconnection attempts", uri, reconnectAttempt);
            setState(ConnectionState.DISCONNECTED);
            deliverReconnectFailed(reconnectAttempt);
            return;
        }
        setState(ConnectionState.RECONNECTING);
        scheduleReconnect(generation);
    }

    /**
     * Must be called while holding the lock.
     */
    private void scheduleReconnect(final long gen) {
        reconnectTask = scheduler.schedule(() -> attemptReconnect(gen), reconnectDelay.get(), TimeUnit.MILLISECONDS);
    }

    /**
     * Make one attempt to restore the connection, and arrange the next one if it fails, unless we have run
     * out of attempts.
     *
     * @param gen the generation of the reconnection sequence
     */
    private void attemptReconnect(long gen) {
        final int attempt;
        synchronized (this) {
            if (gen != generation || state != ConnectionState.RECONNECTING) {
                return;
            }
            reconnectTask = null;
            reconnectAttempt++;
            attempt = reconnectAttempt;
        }
        logger.info("Reconnection attempt {} of {} to {}", attempt, maxReconnectAttempts.get(), uri);
        if (establish(gen, ConnectionState.RECONNECTING)) {
            return;
        }
        synchronized (this) {
            if (gen != generation || state != ConnectionState.RECONNECTING) {
                return;
            }
            if (attempt >= maxReconnectAttempts.get()) {
                logger.error("Giving up on {} after {} reconnection attempts", uri, attempt);
                setState(ConnectionState.DISCONNECTED);
                deliverReconnectFailed(attempt);
            } else {
                scheduleReconnect(gen);
            }
        }
    }

    /**
     * Send a message to the device.
     *
     * @param message the message to send
     *
     * @throws IllegalStateException if we are not connected
     * @throws IOException if the message could not be sent
     */
    @API(status = API.Status.STABLE)
    public void sendMessage(Message message) throws IOException {
        final String text = MessageCodec.encode(message);
        transmit(t -> t.sendText(text), message.type + " message");
    }

    /**
     * Send raw audio to the device in a binary frame.
     *
     * @param data the audio bytes
     *
     * @throws IllegalStateException if we are not connected
     * @throws IOException if the data could not be sent
     */
    @API(status = API.Status.STABLE)
    public void send(byte[] data) throws IOException {
        final ByteBuffer buffer = ByteBuffer.wrap(data.clone());
        transmit(t -> t.sendBinary(buffer), data.length + " bytes of audio");
    }

    /**
     * Hand a frame to the open connection and wait until it has been sent. Sends are never queued for later:
     * if there is no connection the caller finds out immediately.
     *
     * @param operation performs the send on the connection
     * @param description what is being sent, for error messages
     *
     * @throws IllegalStateException if we are not connected
     * @throws IOException if the send failed or took too long
     */
    private void transmit(Function<Transport, CompletableFuture<?>> operation, String description) throws IOException {
        final Transport current;
        synchronized (this) {
            if (state != ConnectionState.CONNECTED || transport == null) {
                throw new IllegalStateException("Not connected, unable to send " + description);
            }
            current = transport;
        }
        synchronized (sendLock) {
            try {
                operation.apply(current).get(sendTimeout.get(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw sendFailed(current, "Unable to send " + description, e.getCause());
            } catch (TimeoutException e) {
                throw sendFailed(current, "Timed out sending " + description, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted sending " + description, e);
            }
        }
        logger.trace("Sent {}", description);
    }

    /**
     * Report a failed send to listeners, unless the connection it was sent on has since been closed or replaced,
     * and build the exception to throw to the sender.
     *
     * @param used the connection the send was attempted on
     * @param message a description of the failure
     * @param cause what went wrong
     *
     * @return the exception to throw
     */
    private IOException sendFailed(Transport used, String message, Throwable cause) {
        synchronized (this) {
            if (transport == used) {
                logger.warn("{}: {}", message, describe(cause));
                deliverError(message, cause);
            } else {
                logger.debug("{} on a connection that is no longer open: {}", message, describe(cause));
            }
        }
        return new IOException(message, cause);
    }

    /**
     * Interpret a text frame from the device and act on it.
     *
     * @param text the content of the frame
     */
    private void dispatch(String text) {
        final Message message;
        try {
            message = MessageCodec.decode(text);
        } catch (MessageFormatException e) {
            logger.warn("Dropping malformed message from device: {}", e.getMessage());
            return;
        }
        if (message.knownType == null) {
            logger.debug("Dropping message of unknown type {}", message.type);
            return;
        }
        switch (message.knownType) {
            case PING:
                scheduler.execute(() -> {
                    try {
                        sendMessage(Message.of(Message.KnownType.PONG));
                    } catch (IOException | IllegalStateException e) {
                        logger.debug("Unable to answer ping: {}", e.toString());
                    }
                });
                break;

            case PONG:
                logger.trace("Received pong");
                break;

            case RECOGNITION_RESULT:
                try {
                    deliverRecognitionResult(MessageCodec.decodeRecognitionResult(message));
                } catch (MessageFormatException e) {
                    logger.warn("Dropping unreadable recognition result: {}", e.getMessage());
                }
                break;

            case ERROR:
                final String error = MessageCodec.errorText(message);
                logger.warn("Device reported error: {}", error);
                lastError = error;
                deliverError(error, null);
                break;
        }
    }

    /**
     * Check whether a handler belongs to the connection we are currently interested in. Must be called while
     * holding the lock.
     */
    private boolean isCurrent(Handler handler) {
        return handler.gen == generation;
    }

    /**
     * A connection has closed or failed. If it is the open connection, start reconnecting; if it was still being
     * opened, remember that so the open is treated as a failure. Connections we close ourselves are always
     * superseded by then, so they end up ignored here.
     *
     * @param handler receives the events of the connection that ended
     * @param reason a description of how the connection ended
     * @param cause the exception that reported the failure, if any
     */
    private synchronized void connectionEnded(Handler handler, String reason, Throwable cause) {
        if (!isCurrent(handler)) {
            logger.debug("Ignoring end of superseded connection: {}", reason);
            return;
        }
        if (handler != activeHandler) {
            handler.closedEarly = true;
            return;
        }
        beginReconnect(reason, cause);
    }

    /**
     * Must be called while holding the lock, so that state changes are delivered in the order they happened.
     *
     * @param newState the state being entered
     */
    private void setState(ConnectionState newState) {
        final ConnectionState oldState = state;
        if (oldState == newState) {
            return;
        }
        state = newState;
        logger.debug("Connection state {} -> {}", oldState, newState);
        deliverStateChanged(oldState, newState);
    }

    /**
     * Adds the specified connection listener to receive state changes and errors. If {@code listener} is
     * {@code null} or already present in the set of registered listeners, no exception is thrown and no
     * action is performed.
     *
     * @param listener the connection listener to add
     */
    @API(status = API.Status.STABLE)
    public void addConnectionListener(ConnectionListener listener) {
        if (listener != null) {
            connectionListeners.add(listener);
        }
    }

    /**
     * Removes the specified connection listener. If {@code listener} is {@code null} or not present in the set
     * of registered listeners, no exception is thrown and no action is performed.
     *
     * @param listener the connection listener to remove
     */
    @API(status = API.Status.STABLE)
    public void removeConnectionListener(ConnectionListener listener) {
        if (listener != null) {
            connectionListeners.remove(listener);
        }
    }

    /**
     * Get the set of connection listeners that are currently registered.
     *
     * @return the currently registered connection listeners
     */
    @API(status = API.Status.STABLE)
    public Set<ConnectionListener> getConnectionListeners() {
        // Make a copy so callers get an immutable snapshot of the current state.
        return Set.copyOf(connectionListeners);
    }

    /**
     * Adds the specified recognition listener to receive results from the device. If {@code listener} is
     * {@code null} or already present in the set of registered listeners, no exception is thrown and no
     * action is performed.
     *
     * @param listener the recognition listener to add
     */
    @API(status = API.Status.STABLE)
    public void addRecognitionListener(RecognitionListener listener) {
        if (listener != null) {
            recognitionListeners.add(listener);
        }
    }

    /**
     * Removes the specified recognition listener. If {@code listener} is {@code null} or not present in the set
     * of registered listeners, no exception is thrown and no action is performed.
     *
     * @param listener the recognition listener to remove
     */
    @API(status = API.Status.STABLE)
    public void removeRecognitionListener(RecognitionListener listener) {
        if (listener != null) {
            recognitionListeners.remove(listener);
        }
    }

    /**
     * Get the set of recognition listeners that are currently registered.
     *
     * @return the currently registered recognition listeners
     */
    @API(status = API.Status.STABLE)
    public Set<RecognitionListener> getRecognitionListeners() {
        // Make a copy so callers get an immutable snapshot of the current state.
        return Set.copyOf(recognitionListeners);
    }

    private void deliverStateChanged(final ConnectionState oldState, final ConnectionState newState) {
        for (final ConnectionListener listener : getConnectionListeners()) {
            eventDelivery.execute(() -> {
                try {
                    listener.stateChanged(oldState, newState);
                } catch (Throwable t) {
                    logger.warn("Problem delivering state change to listener", t);
                }
            });
        }
    }

    private void deliverError(final String message, final Throwable cause) {
        for (final ConnectionListener listener : getConnectionListeners()) {
            eventDelivery.execute(() -> {
                try {
                    listener.errorOccurred(message, cause);
                } catch (Throwable t) {
                    logger.warn("Problem delivering error to listener", t);
                }
            });
        }
    }

    private void deliverReconnectFailed(final int attempts) {
        for (final ConnectionListener listener : getConnectionListeners()) {
            eventDelivery.execute(() -> {
                try {
                    listener.reconnectFailed(attempts);
                } catch (Throwable t) {
                    logger.warn("Problem delivering reconnection failure to listener", t);
                }
            });
        }
    }

    private void deliverRecognitionResult(final RecognitionResult result) {
        for (final RecognitionListener listener : getRecognitionListeners()) {
            eventDelivery.execute(() -> {
                try {
                    listener.recognitionResultReceived(result);
                } catch (Throwable t) {
                    logger.warn("Problem delivering recognition result to listener", t);
                }
            });
        }
    }

    @Override
    public String toString() {
        return "ConnectionManager[state:" + getState() + ", uri:" + getUri() + "]";
    }

    /**
     * Receives the events of one connection, on behalf of the generation that opened it.
     */
    private class Handler implements TransportListener {

        final long gen;

        /**
         * Set if the connection ended before it was adopted. Guarded by the manager's lock.
         */
        boolean closedEarly;

        Handler(long gen) {
            this.gen = gen;
        }

        /**
         * Note that the device has sent us something. Once a restored connection carries traffic it has proven
         * itself, and any later loss gets the full number of reconnection attempts again.
         *
         * @return {@code false} if this connection has been superseded, and what it received should be ignored
         */
        private boolean heardFrom() {
            synchronized (ConnectionManager.this) {
                if (!isCurrent(this)) {
                    return false;
                }
                lastHeartbeatAt = System.currentTimeMillis();
                if (this == activeHandler && reconnectAttempt > 0) {
                    logger.debug("Connection to {} restored after {} attempt(s)", uri, reconnectAttempt);
                    reconnectAttempt = 0;
                }
                return true;
            }
        }

        @Override
        public void textReceived(String text) {
            if (!heardFrom()) {
                logger.debug("Ignoring message from superseded connection");
                return;
            }
            dispatch(text);
        }

        @Override
        public void binaryReceived(ByteBuffer data) {
            if (!heardFrom()) {
                return;
            }
            logger.debug("Received {} bytes of binary data from device", data.remaining());
        }

        @Override
        public void closed(int code, String reason, boolean clean) {
            connectionEnded(this, "Connection closed with code " + code +
                    (reason == null || reason.isEmpty() ? "" : " (" + reason + ")"), null);
        }

        @Override
        public void failed(Throwable cause) {
            connectionEnded(this, "Connection failed: " + describe(cause), cause);
        }
    }
}
