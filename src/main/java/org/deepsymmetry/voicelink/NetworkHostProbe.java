package org.deepsymmetry.voicelink;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Probes hosts over the real network. The handshake is a plain TCP connection to the service port. Once a host
 * has accepted it, {@link #describe(Device)} asks the device about itself over HTTP and looks up its hardware
 * address, but neither of those steps can disqualify it.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class NetworkHostProbe implements HostProbe {

    private static final Logger logger = LoggerFactory.getLogger(NetworkHostProbe.class);

    /**
     * The port on which devices offer their service, their self-description, and their streaming endpoint.
     */
    @API(status = API.Status.STABLE)
    public static final int SERVICE_PORT = 8000;

    /**
     * The default number of milliseconds to wait for a host to respond to a reachability check.
     */
    public static final int DEFAULT_REACHABILITY_TIMEOUT = 1000;

    /**
     * The default number of milliseconds to wait for the service port to accept a connection.
     */
    public static final int DEFAULT_HANDSHAKE_TIMEOUT = 3000;

    /**
     * The default number of milliseconds to wait for a device to describe itself.
     */
    public static final int DEFAULT_CAPABILITY_TIMEOUT = 5000;

    private final AtomicInteger reachabilityTimeout = new AtomicInteger(DEFAULT_REACHABILITY_TIMEOUT);

    private final AtomicInteger handshakeTimeout = new AtomicInteger(DEFAULT_HANDSHAKE_TIMEOUT);

    private final AtomicInteger capabilityTimeout = new AtomicInteger(DEFAULT_CAPABILITY_TIMEOUT);

    /**
     * The port being probed.
     */
    private final int port;

    /**
     * Finds hardware addresses of hosts that answer the handshake.
     */
    private final HardwareAddressResolver hardwareAddressResolver;

    /**
     * Used to ask devices to describe themselves. Rebuilt when the handshake timeout changes, since that also
     * limits how long the request may spend connecting.
     */
    private final AtomicReference<HttpClient> httpClient = new AtomicReference<>();

    /**
     * Create a probe for devices on the standard {@link #SERVICE_PORT}.
     */
    @API(status = API.Status.STABLE)
    public NetworkHostProbe() {
        this(SERVICE_PORT);
    }

    /**
     * Create a probe for devices on a nonstandard port.
     *
     * @param port the port on which devices offer their service
     */
    @API(status = API.Status.STABLE)
    public NetworkHostProbe(int port) {
        this(port, new HardwareAddressResolver());
    }

    /**
     * Create a probe for devices on a nonstandard port, using a particular way of finding hardware addresses.
     *
     * @param port the port on which devices offer their service
     * @param hardwareAddressResolver looks up the hardware addresses of devices that are found
     *
     * @throws IllegalArgumentException if {@code port} is out of range or the resolver is {@code null}
     */
    @API(status = API.Status.STABLE)
    public NetworkHostProbe(int port, HardwareAddressResolver hardwareAddressResolver) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535, got " + port);
        }
        if (hardwareAddressResolver == null) {
            throw new IllegalArgumentException("hardwareAddressResolver must not be null");
        }
        this.port = port;
        this.hardwareAddressResolver = hardwareAddressResolver;
        httpClient.set(buildHttpClient(DEFAULT_HANDSHAKE_TIMEOUT));
    }

    private static HttpClient buildHttpClient(int connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeout))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    /**
     * Get the client used to fetch capabilities.
     *
     * @return the client, whose connect timeout is the handshake timeout
     */
    HttpClient getHttpClient() {
        return httpClient.get();
    }

    /**
     * Get the port being probed.
     *
     * @return the service port
     */
    public int getPort() {
        return port;
    }

    /**
     * Set how long we wait for a host to respond to a reachability check.
     *
     * @param timeout the maximum number of milliseconds to wait
     *
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    public void setReachabilityTimeout(int timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        reachabilityTimeout.set(timeout);
    }

    /**
     * Check how long we wait for a host to respond to a reachability check.
     *
     * @return the maximum number of milliseconds to wait
     */
    public int getReachabilityTimeout() {
        return reachabilityTimeout.get();
    }

    /**
     * Set how long we wait for the service port to accept a connection.
     *
     * @param timeout the maximum number of milliseconds to wait
     *
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    public void setHandshakeTimeout(int timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        handshakeTimeout.set(timeout);
        httpClient.set(buildHttpClient(timeout));
    }

    /**
     * Check how long we wait for the service port to accept a connection.
     *
     * @return the maximum number of milliseconds to wait
     */
    public int getHandshakeTimeout() {
        return handshakeTimeout.get();
    }

    /**
     * Set how long we wait for a device to describe itself, once its service port has accepted the request.
     *
     * @param timeout the maximum number of milliseconds to wait
     *
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    public void setCapabilityTimeout(int timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        capabilityTimeout.set(timeout);
    }

    /**
     * Check how long we wait for a device to describe itself.
     *
     * @return the maximum number of milliseconds to wait
     */
    public int getCapabilityTimeout() {
        return capabilityTimeout.get();
    }

    /**
     * Set how long the neighbor table lookup for a device's hardware address may take.
     *
     * @param timeout the maximum number of milliseconds to wait
     *
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    public void setHardwareLookupTimeout(int timeout) {
        hardwareAddressResolver.setLookupTimeout(timeout);
    }

    /**
     * Check how long the neighbor table lookup for a device's hardware address may take.
     *
     * @return the maximum number of milliseconds to wait
     */
    public int getHardwareLookupTimeout() {
        return (int) hardwareAddressResolver.getLookupTimeout();
    }

    @Override
    public Device probeAddress(InetAddress address) {
        try {
            if (!address.isReachable(reachabilityTimeout.get())) {
                return null;
            }
        } catch (IOException e) {
            logger.debug("Reachability check of {} failed: {}", address.getHostAddress(), e.toString());
            return null;
        }
        return probeService(address, null);
    }

    @Override
    public Device probeHostname(String hostname) {
        final InetAddress address;
        try {
            address = firstIpv4Address(hostname);
        } catch (UnknownHostException e) {
            logger.debug("Unable to resolve host name {}", hostname);
            return null;
        }
        if (address == null) {
            logger.debug("Host name {} has no IPv4 address", hostname);
            return null;
        }
        return probeService(address, hostname);
    }

    @Override
    public Device describe(Device device) {
        final InetAddress address = device.getAddress();
        final DeviceCapabilities capabilities = fetchCapabilities(address);
        final String hardwareAddress = hardwareAddressResolver.resolve(address);
        return new Device(address, device.getHostname(), device.getPort(), hardwareAddress, capabilities,
                device.getLastSeen());
    }

    /**
     * Resolve a host name and pick out its first IPv4 address.
     *
     * @param hostname the name to resolve
     *
     * @return the first IPv4 address, or {@code null} if the name only resolves to other kinds of address
     *
     * @throws UnknownHostException if the name cannot be resolved at all
     */
    private static InetAddress firstIpv4Address(String hostname) throws UnknownHostException {
        for (InetAddress candidate : InetAddress.getAllByName(hostname)) {
            if (candidate instanceof Inet4Address) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Perform the service handshake with an address.
     *
     * @param address the address to probe
     * @param hostname the host name that was resolved to find the address, if any
     *
     * @return the device, without optional details, or {@code null} if the handshake failed
     */
    private Device probeService(InetAddress address, String hostname) {
        if (!handshake(address)) {
            return null;
        }
        logger.debug("Service port {} open on {}", port, address.getHostAddress());
        return new Device(address, hostname, port, null, null, System.currentTimeMillis());
    }

    /**
     * See whether the service port accepts a TCP connection.
     *
     * @param address the address to try
     *
     * @return {@code true} if the connection was accepted in time
     */
    private boolean handshake(InetAddress address) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(address, port), handshakeTimeout.get());
            return true;
        } catch (IOException e) {
            logger.trace("Handshake with {}:{} failed: {}", address.getHostAddress(), port, e.toString());
            return false;
        }
    }

    /**
     * Ask a device to describe itself.
     *
     * @param address the address of the device
     *
     * @return what the device reported, or {@code null} if it would not answer or the answer made no sense
     */
    private DeviceCapabilities fetchCapabilities(InetAddress address) {
        final URI uri = URI.create("http://" + address.getHostAddress() + ":" + port + DeviceCapabilities.INFO_PATH);
        try {
            final HttpRequest request = HttpRequest.newBuilder(uri)
                    .timeout(Duration.ofMillis(capabilityTimeout.get()))
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            final HttpResponse<String> response = httpClient.get().send(request,
                    HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() > 299) {
                logger.debug("Device at {} answered {} with status {}", address.getHostAddress(),
                        DeviceCapabilities.INFO_PATH, response.statusCode());
                return null;
            }
            return DeviceCapabilities.parse(response.body());
        } catch (IOException e) {
            logger.debug("Unable to get capabilities from {}: {}", uri, e.toString());
        } catch (InterruptedException e) {
            logger.debug("Interrupted getting capabilities from {}", uri);
            Thread.currentThread().interrupt();
        }
        return null;
    }
}
