package org.deepsymmetry.voicelink;

import org.apiguardian.api.API;

import java.net.Inet4Address;
import java.net.InetAddress;

/**
 * Represents a device which answered the service handshake on its port. Devices are immutable: a fresh probe
 * of the same host produces a new {@code Device}, and callers replace stale entries by comparing
 * {@link #getReference()} values.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class Device {

    /**
     * The address on which the device was reached.
     */
    private final Inet4Address address;

    /**
     * The host name that was resolved to reach the device, if it was found that way.
     */
    private final String hostname;

    /**
     * The port on which the device offers its service.
     */
    private final int port;

    /**
     * The hardware (MAC) address of the device, if it could be found in the neighbor table.
     */
    private final String hardwareAddress;

    /**
     * The details the device reported about itself, if it was willing.
     */
    private final DeviceCapabilities capabilities;

    /**
     * The time at which the device last answered a probe.
     */
    private final long lastSeen;

    /**
     * Constructor sets all the immutable fields.
     *
     * @param address the IPv4 address on which the device was reached
     * @param hostname the host name used to reach the device, or {@code null} if it was found by address
     * @param port the port on which the device offers its service
     * @param hardwareAddress the MAC address of the device, or {@code null} if unknown
     * @param capabilities what the device reported about itself, or {@code null} if unavailable
     * @param lastSeen the millisecond timestamp at which the device answered the probe
     *
     * @throws IllegalArgumentException if {@code address} is not an IPv4 address or {@code port} is out of range
     */
    @API(status = API.Status.STABLE)
    public Device(InetAddress address, String hostname, int port, String hardwareAddress,
                  DeviceCapabilities capabilities, long lastSeen) {
        if (!(address instanceof Inet4Address)) {
            throw new IllegalArgumentException("Devices must have IPv4 addresses, got " + address);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535, got " + port);
        }
        this.address = (Inet4Address) address;
        this.hostname = hostname;
        this.port = port;
        this.hardwareAddress = hardwareAddress;
        this.capabilities = capabilities;
        this.lastSeen = lastSeen;
    }

    /**
     * Get the address on which the device was reached.
     *
     * @return the IPv4 address of the device
     */
    @API(status = API.Status.STABLE)
    public Inet4Address getAddress() {
        return address;
    }

    /**
     * Get the host name which was resolved to reach the device.
     *
     * @return the host name, or {@code null} if the device was found by scanning addresses
     */
    @API(status = API.Status.STABLE)
    public String getHostname() {
        return hostname;
    }

    /**
     * Get the port on which the device offers its service.
     *
     * @return the service port
     */
    @API(status = API.Status.STABLE)
    public int getPort() {
        return port;
    }

    /**
     * Get the hardware address of the device, as found in the local neighbor table.
     *
     * @return the upper-case MAC address, or {@code null} if it could not be determined
     */
    @API(status = API.Status.STABLE)
    public String getHardwareAddress() {
        return hardwareAddress;
    }

    /**
     * Get the details the device reported about itself.
     *
     * @return the capabilities, or {@code null} if the device did not report them or they could not be understood
     */
    @API(status = API.Status.STABLE)
    public DeviceCapabilities getCapabilities() {
        return capabilities;
    }

    /**
     * Check whether the device reported its capabilities.
     *
     * @return {@code true} if {@link #getCapabilities()} will return a value
     */
    public boolean hasCapabilities() {
        return capabilities != null;
    }

    /**
     * Get the time at which the device answered the probe that produced this object.
     *
     * @return the millisecond timestamp of the successful probe
     */
    @API(status = API.Status.STABLE)
    public long getLastSeen() {
        return lastSeen;
    }

    /**
     * Devices only exist once they have answered a probe, so they are considered online.
     *
     * @return {@code true}
     */
    public boolean isOnline() {
        return true;
    }

    /**
     * Get the name by which the device should be shown to people: the name it reported about itself if
     * there is one, otherwise the host name that was used to reach it, otherwise a name built from its address.
     *
     * @return the name to display for the device
     */
    @API(status = API.Status.STABLE)
    public String getDisplayName() {
        if (capabilities != null && capabilities.getName() != null && !capabilities.getName().isBlank()) {
            return capabilities.getName();
        }
        if (hostname != null && !hostname.isBlank()) {
            return hostname;
        }
        return "device@" + address.getHostAddress();
    }

    /**
     * Get the address and port at which the device can be reached, in the form {@code address:port}.
     *
     * @return the connection string
     */
    @API(status = API.Status.STABLE)
    public String getConnectionString() {
        return address.getHostAddress() + ":" + port;
    }

    /**
     * Get the identity by which this device is distinguished from others on the network.
     *
     * @return the reference combining the address and port of the device
     */
    @API(status = API.Status.STABLE)
    public DeviceReference getReference() {
        return DeviceReference.getDeviceReference(this);
    }

    @Override
    public String toString() {
        return "Device[name:" + getDisplayName() + ", address:" + getConnectionString() +
                ", hostname:" + hostname + ", hardwareAddress:" + hardwareAddress +
                ", capabilities:" + capabilities + ", lastSeen:" + lastSeen + "]";
    }
}
