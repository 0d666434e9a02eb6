package org.deepsymmetry.voicelink.stream;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.Assert.*;

public class ConnectionManagerTest {

    private FakeTransportFactory factory;
    private ConnectionManager manager;
    private RecordingListener listener;

    /**
     * Records connection events as compact strings.
     */
    private static class RecordingListener implements ConnectionListener, RecognitionListener {
        final List<String> states = Collections.synchronizedList(new ArrayList<>());
        final List<String> errors = Collections.synchronizedList(new ArrayList<>());
        final List<Integer> reconnectFailures = Collections.synchronizedList(new ArrayList<>());
        final List<RecognitionResult> results = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void stateChanged(ConnectionState oldState, ConnectionState newState) {
            states.add(oldState + "->" + newState);
        }

        @Override
        public void errorOccurred(String message, Throwable cause) {
            errors.add(message);
        }

        @Override
        public void reconnectFailed(int attempts) {
            reconnectFailures.add(attempts);
        }

        @Override
        public void recognitionResultReceived(RecognitionResult result) {
            results.add(result);
        }
    }

    private static void waitFor(String description, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }

    @Before
    public void setUp() {
        factory = new FakeTransportFactory();
        manager = new ConnectionManager(factory);
        listener = new RecordingListener();
        manager.addConnectionListener(listener);
        manager.addRecognitionListener(listener);
    }

    @After
    public void tearDown() {
        manager.disconnect();
    }

    @Test
    public void connectOpensStreamingEndpoint() throws Exception {
        assertTrue(manager.connect("10.0.0.42", 8000));
        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertTrue(manager.isConnected());
        assertEquals("ws://10.0.0.42:8000/ws/audio", factory.lastUri.get().toString());
        assertTrue(manager.getLastHeartbeatAt() > 0);
        assertEquals(0, manager.getReconnectAttempt());
        waitFor("connection events", () -> listener.states.size() == 2);
        assertEquals(List.of("DISCONNECTED->CONNECTING", "CONNECTING->CONNECTED"), listener.states);
    }

    @Test
    public void secureEndpointOnPort443() throws Exception {
        assertTrue(manager.connect("voice.example.com", 443));
        assertEquals("wss://voice.example.com:443/ws/audio", factory.lastUri.get().toString());
    }

    @Test
    public void connectTimeoutLeavesDisconnected() throws Exception {
        factory.mode.set(FakeTransportFactory.Mode.NEVER);
        manager.setConnectionTimeout(200);
        manager.setHeartbeatInterval(50);

        assertFalse(manager.connect("10.0.0.42", 8000));

        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertNotNull(manager.getLastError());
        waitFor("failure events", () -> listener.states.size() == 2 && listener.errors.size() == 1);
        Thread.sleep(300);
        assertEquals(List.of("DISCONNECTED->CONNECTING", "CONNECTING->DISCONNECTED"), listener.states);
        assertEquals(1, factory.opens.get());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
    }

    @Test
    public void refusedConnectionFails() throws Exception {
        factory.mode.set(FakeTransportFactory.Mode.FAIL);
        assertFalse(manager.connect("10.0.0.42", 8000));
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertTrue(manager.getLastError().contains("Connection refused"));
    }

    @Test
    public void serverThatNeverUpgradesTimesOut() throws Exception {
        try (ServerSocket silent = new ServerSocket(0, 5, InetAddress.getLoopbackAddress())) {
            ConnectionManager real = new ConnectionManager();
            real.setConnectionTimeout(500);
            long started = System.currentTimeMillis();
            assertFalse(real.connect("127.0.0.1", silent.getLocalPort()));
            assertTrue(System.currentTimeMillis() - started < 5000);
            assertEquals(ConnectionState.DISCONNECTED, real.getState());
            assertNotNull(real.getLastError());
            real.disconnect();
        }
    }

    @Test
    public void disconnectIsIdempotent() throws Exception {
        manager.disconnect();
        assertTrue(manager.connect("10.0.0.42", 8000));
        FakeTransportFactory.FakeTransport transport = factory.latest();

        manager.disconnect();
        manager.disconnect();

        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertEquals(ConnectionManager.NORMAL_CLOSURE, transport.closeCode.get());
        waitFor("disconnect events", () -> listener.states.size() == 4);
        Thread.sleep(100);
        assertEquals(List.of("DISCONNECTED->CONNECTING", "CONNECTING->CONNECTED",
                "CONNECTED->DISCONNECTING", "DISCONNECTING->DISCONNECTED"), listener.states);
        assertTrue(listener.errors.isEmpty());
    }

    @Test
    public void uncleanCloseReconnects() throws Exception {
        manager.setReconnectDelay(50);
        assertTrue(manager.connect("10.0.0.42", 8000));

        factory.latest().dropUnclean();

        waitFor("reconnection", () -> manager.isConnected() && factory.transports.size() == 2);
        assertEquals(2, factory.opens.get());
        waitFor("reconnection events", () -> listener.states.contains("RECONNECTING->CONNECTED"));
        assertTrue(listener.states.contains("CONNECTED->RECONNECTING"));
        assertEquals(1, listener.errors.size());
        assertEquals(1, manager.getReconnectAttempt());

        factory.latest().receive(MessageCodec.encode(Message.of(Message.KnownType.PONG)));

        assertEquals(0, manager.getReconnectAttempt());
    }

    @Test
    public void flappingConnectionExhaustsReconnectAttempts() throws Exception {
        manager.setMaxReconnectAttempts(3);
        manager.setReconnectDelay(20);
        assertTrue(manager.connect("10.0.0.42", 8000));

        for (int restored = 1; restored <= 3; restored++) {
            factory.latest().dropUnclean();
            final int expected = restored + 1;
            waitFor("restored connection " + restored,
                    () -> factory.transports.size() == expected && manager.isConnected());
            assertEquals(restored, manager.getReconnectAttempt());
        }
        factory.latest().dropUnclean();

        waitFor("reconnection failure", () -> listener.reconnectFailures.size() == 1);
        assertEquals(Integer.valueOf(3), listener.reconnectFailures.get(0));
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        Thread.sleep(200);
        assertEquals(4, factory.opens.get());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());

        assertTrue(manager.connect("10.0.0.42", 8000));
        assertEquals(0, manager.getReconnectAttempt());
    }

    @Test
    public void noReconnectAttemptsMeansImmediateFailure() throws Exception {
        manager.setMaxReconnectAttempts(0);
        assertTrue(manager.connect("10.0.0.42", 8000));

        factory.latest().dropUnclean();

        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        waitFor("reconnection failure", () -> listener.reconnectFailures.size() == 1);
        assertEquals(Integer.valueOf(0), listener.reconnectFailures.get(0));
        assertEquals(1, factory.opens.get());
    }

    @Test
    public void reconnectGivesUpAfterMaximumAttempts() throws Exception {
        manager.setMaxReconnectAttempts(3);
        manager.setReconnectDelay(20);
        assertTrue(manager.connect("10.0.0.42", 8000));
        factory.mode.set(FakeTransportFactory.Mode.FAIL);

        factory.latest().dropUnclean();

        waitFor("reconnection failure", () -> listener.reconnectFailures.size() == 1);
        assertEquals(Integer.valueOf(3), listener.reconnectFailures.get(0));
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertEquals(4, factory.opens.get());
        Thread.sleep(200);
        assertEquals(4, factory.opens.get());
        assertEquals(1, listener.reconnectFailures.size());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
    }

    @Test
    public void silentDeviceTriggersReconnect() throws Exception {
        manager.setHeartbeatInterval(50);
        manager.setHeartbeatTimeout(150);
        manager.setReconnectDelay(10000);
        assertTrue(manager.connect("10.0.0.42", 8000));
        FakeTransportFactory.FakeTransport transport = factory.latest();

        waitFor("heartbeat timeout", () -> manager.getState() == ConnectionState.RECONNECTING);
        assertTrue(transport.aborted);
    }

    @Test
    public void trafficKeepsConnectionAlive() throws Exception {
        manager.setHeartbeatInterval(50);
        manager.setHeartbeatTimeout(200);
        assertTrue(manager.connect("10.0.0.42", 8000));
        FakeTransportFactory.FakeTransport transport = factory.latest();

        for (int i = 0; i < 10; i++) {
            transport.receive("{\"type\": \"status_update\"}");
            Thread.sleep(50);
        }
        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertTrue(transport.sentType("ping"));
    }

    @Test
    public void pingIsAnsweredWithPong() throws Exception {
        assertTrue(manager.connect("10.0.0.42", 8000));
        FakeTransportFactory.FakeTransport transport = factory.latest();

        transport.receive("{\"type\": \"ping\", \"timestamp\": \"2024-05-01T08:00:00\"}");

        waitFor("pong", () -> transport.sentType("pong"));
    }

    @Test
    public void recognitionResultIsDelivered() throws Exception {
        assertTrue(manager.connect("10.0.0.42", 8000));

        factory.latest().receive("{\"type\": \"recognition_result\", \"data\": " +
                "{\"speaker_name\": \"Alice\", \"confidence\": 91.0}}");

        waitFor("recognition result", () -> listener.results.size() == 1);
        assertEquals("Alice", listener.results.get(0).getSpeakerName());
    }

    @Test
    public void deviceErrorKeepsConnection() throws Exception {
        assertTrue(manager.connect("10.0.0.42", 8000));

        factory.latest().receive("{\"type\": \"error\", \"data\": {\"message\": \"Model not loaded\"}}");

        waitFor("error event", () -> listener.errors.contains("Model not loaded"));
        assertEquals("Model not loaded", manager.getLastError());
        assertEquals(ConnectionState.CONNECTED, manager.getState());
    }

    @Test
    public void unreadableMessagesAreDropped() throws Exception {
        assertTrue(manager.connect("10.0.0.42", 8000));
        FakeTransportFactory.FakeTransport transport = factory.latest();

        transport.receive("this is not json");
        transport.receive("{\"data\": 5}");
        transport.receive("{\"type\": \"mystery\", \"data\": {}}");
        transport.receive("{\"type\": \"recognition_result\", \"data\": 12}");
        transport.receive("{\"type\": \"recognition_result\", \"data\": {\"speaker_name\": \"Bob\"}}");

        waitFor("recognition result", () -> listener.results.size() == 1);
        assertEquals("Bob", listener.results.get(0).getSpeakerName());
        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertTrue(listener.errors.isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void sendWhileDisconnectedFails() throws Exception {
        manager.sendMessage(Message.of(Message.KnownType.PING));
    }

    @Test
    public void sendsTextAndAudio() throws Exception {
        assertTrue(manager.connect("10.0.0.42", 8000));
        FakeTransportFactory.FakeTransport transport = factory.latest();

        manager.sendMessage(Message.of(Message.KnownType.PING));
        manager.send(new byte[] {1, 2, 3});

        assertTrue(transport.sentType("ping"));
        assertEquals(1, transport.sentBinaryFrames.get());
    }

    @Test
    public void disconnectStopsReconnection() throws Exception {
        manager.setReconnectDelay(100);
        manager.setMaxReconnectAttempts(5);
        assertTrue(manager.connect("10.0.0.42", 8000));
        factory.mode.set(FakeTransportFactory.Mode.FAIL);
        factory.latest().dropUnclean();
        assertEquals(ConnectionState.RECONNECTING, manager.getState());

        manager.disconnect();

        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        int opens = factory.opens.get();
        Thread.sleep(400);
        assertEquals(opens, factory.opens.get());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertTrue(listener.reconnectFailures.isEmpty());
    }

    @Test
    public void sendFailingAfterDisconnectIsNotReported() throws Exception {
        assertTrue(manager.connect("10.0.0.42", 8000));
        FakeTransportFactory.FakeTransport transport = factory.latest();
        final CompletableFuture<Void> stalled = new CompletableFuture<>();
        transport.stalledSend = stalled;
        final AtomicReference<Exception> sendOutcome = new AtomicReference<>();
        Thread sender = new Thread(() -> {
            try {
                manager.sendMessage(Message.of(Message.KnownType.PING));
            } catch (Exception e) {
                sendOutcome.set(e);
            }
        });
        sender.start();
        waitFor("send to start", () -> transport.sentType("ping"));

        manager.disconnect();
        stalled.completeExceptionally(new IOException("Broken pipe"));
        sender.join(5000);

        assertTrue(sendOutcome.get() instanceof IOException);
        waitFor("disconnect events", () -> listener.states.contains("DISCONNECTING->DISCONNECTED"));
        Thread.sleep(100);
        assertTrue(listener.errors.isEmpty());
    }

    @Test
    public void sendFailureOnOpenConnectionIsReported() throws Exception {
        assertTrue(manager.connect("10.0.0.42", 8000));
        FakeTransportFactory.FakeTransport transport = factory.latest();
        CompletableFuture<Void> broken = new CompletableFuture<>();
        broken.completeExceptionally(new IOException("Broken pipe"));
        transport.stalledSend = broken;

        try {
            manager.sendMessage(Message.of(Message.KnownType.PING));
            fail("Send should have failed");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("ping"));
        }
        waitFor("error event", () -> listener.errors.size() == 1);
        assertEquals(ConnectionState.CONNECTED, manager.getState());
    }

    @Test
    public void disconnectAbandonsConnectInProgress() throws Exception {
        factory.mode.set(FakeTransportFactory.Mode.NEVER);
        manager.setConnectionTimeout(10000);
        final AtomicReference<Boolean> outcome = new AtomicReference<>();
        Thread connector = new Thread(() -> outcome.set(manager.connect("10.0.0.42", 8000)));
        connector.start();
        waitFor("connecting", () -> manager.getState() == ConnectionState.CONNECTING);

        long started = System.currentTimeMillis();
        manager.disconnect();
        connector.join(5000);

        assertEquals(Boolean.FALSE, outcome.get());
        assertTrue(System.currentTimeMillis() - started < 5000);
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
    }

    @Test
    public void connectingElsewhereClosesOldConnection() throws Exception {
        assertTrue(manager.connect("10.0.0.42", 8000));
        FakeTransportFactory.FakeTransport first = factory.latest();

        assertTrue(manager.connect("10.0.0.43", 8000));

        assertEquals(ConnectionManager.NORMAL_CLOSURE, first.closeCode.get());
        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertEquals("ws://10.0.0.43:8000/ws/audio", manager.getUri().toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBadPort() {
        manager.connect("10.0.0.42", 70000);
    }
}
