package org.deepsymmetry.voicelink;

import com.sun.net.httpserver.HttpServer;
import org.junit.After;
import org.junit.Test;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

public class NetworkHostProbeTest {

    private HttpServer server;

    /**
     * Stands in for the neighbor table, which does not list the loopback address.
     */
    private static class FixedResolver extends HardwareAddressResolver {
        @Override
        public String resolve(InetAddress address) {
            return "B8:27:EB:00:00:01";
        }
    }

    private NetworkHostProbe startDevice(final int status, final String body) throws Exception {
        return startDevice(status, body, 0);
    }

    private NetworkHostProbe startDevice(final int status, final String body, final long delay) throws Exception {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.setExecutor(Executors.newCachedThreadPool(Util.daemonThreadFactory("Test device")));
        server.createContext(DeviceCapabilities.INFO_PATH, exchange -> {
            if (delay > 0) {
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        NetworkHostProbe probe = new NetworkHostProbe(server.getAddress().getPort(), new FixedResolver());
        probe.setCapabilityTimeout(2000);
        return probe;
    }

    @After
    public void stopDevice() {
        if (server != null) {
            server.stop(0);
        }
    }

    private static Device probeAndDescribe(NetworkHostProbe probe) {
        Device device = probe.probeHostname("127.0.0.1");
        return device == null ? null : probe.describe(device);
    }

    @Test
    public void handshakeAloneProducesBareDevice() throws Exception {
        NetworkHostProbe probe = startDevice(200, "{\"name\": \"Den Pi\"}");
        Device device = probe.probeHostname("127.0.0.1");
        assertNotNull(device);
        assertEquals("127.0.0.1", device.getHostname());
        assertNull(device.getCapabilities());
        assertNull(device.getHardwareAddress());
    }

    @Test
    public void serverErrorStillProducesDevice() throws Exception {
        NetworkHostProbe probe = startDevice(500, "{\"detail\": \"broken\"}");
        Device device = probeAndDescribe(probe);
        assertNotNull(device);
        assertEquals("127.0.0.1", device.getAddress().getHostAddress());
        assertEquals(probe.getPort(), device.getPort());
        assertNull(device.getCapabilities());
        assertEquals("B8:27:EB:00:00:01", device.getHardwareAddress());
        assertTrue(device.getLastSeen() > 0);
    }

    @Test
    public void capabilitiesAreRead() throws Exception {
        NetworkHostProbe probe = startDevice(200, "{\"name\": \"Den Pi\", \"version\": \"2.0\"}");
        Device device = probeAndDescribe(probe);
        assertNotNull(device);
        assertTrue(device.hasCapabilities());
        assertEquals("2.0", device.getCapabilities().getVersion());
        assertEquals("Den Pi", device.getDisplayName());
    }

    @Test
    public void malformedCapabilitiesStillProduceDevice() throws Exception {
        NetworkHostProbe probe = startDevice(200, "{\"name\": [");
        Device device = probeAndDescribe(probe);
        assertNotNull(device);
        assertNull(device.getCapabilities());
        assertEquals("127.0.0.1", device.getDisplayName());
    }

    @Test
    public void closedPortProducesNothing() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        NetworkHostProbe probe = new NetworkHostProbe(port, new FixedResolver());
        assertNull(probe.probeHostname("127.0.0.1"));
    }

    @Test
    public void unknownHostProducesNothing() {
        NetworkHostProbe probe = new NetworkHostProbe(8000, new FixedResolver());
        assertNull(probe.probeHostname("no-such-device.invalid"));
    }

    @Test
    public void slowDescriptionDoesNotDelayDiscoveryEvent() throws Exception {
        NetworkHostProbe probe = startDevice(500, "{}", 3000);
        probe.setCapabilityTimeout(5000);
        AddressSpaceEnumerator loopbackOnly = new AddressSpaceEnumerator() {
            @Override
            public List<Subnet> enumerateSubnets() {
                return List.of();
            }
        };
        loopbackOnly.setWellKnownHostnames(List.of("127.0.0.1"));
        DeviceFinder finder = new DeviceFinder(loopbackOnly, probe);
        final CountDownLatch discovered = new CountDownLatch(1);
        final AtomicLong discoveredAt = new AtomicLong();
        finder.addDeviceDiscoveryListener(new DeviceDiscoveryAdapter() {
            @Override
            public void deviceDiscovered(Device device) {
                discoveredAt.set(System.currentTimeMillis());
                discovered.countDown();
            }
        });

        long started = System.currentTimeMillis();
        Set<Device> found = finder.discover();

        assertEquals(1, found.size());
        assertTrue(discovered.await(5, TimeUnit.SECONDS));
        long delay = discoveredAt.get() - started;
        assertTrue("device announced after " + delay + " ms", delay < 1500);
        assertEquals("B8:27:EB:00:00:01", found.iterator().next().getHardwareAddress());
    }

    @Test
    public void handshakeTimeoutLimitsCapabilityConnect() {
        NetworkHostProbe probe = new NetworkHostProbe(8000, new FixedResolver());
        assertEquals(Optional.of(Duration.ofMillis(NetworkHostProbe.DEFAULT_HANDSHAKE_TIMEOUT)),
                probe.getHttpClient().connectTimeout());

        probe.setHandshakeTimeout(1234);

        assertEquals(1234, probe.getHandshakeTimeout());
        assertEquals(Optional.of(Duration.ofMillis(1234)), probe.getHttpClient().connectTimeout());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBadPort() {
        new NetworkHostProbe(0);
    }
}
