package org.deepsymmetry.voicelink;

import org.apiguardian.api.API;

import java.net.InetAddress;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Uniquely identifies a device on the network by the combination of its IP address and service port. Devices
 * are immutable, so every probe produces a new {@link Device}; this is the identity by which a newer one replaces
 * an older one. The factory method ensures that for a given address and port pair, the same instance will always
 * be returned, so object reference equality can be used to distinguish devices in sets and hash maps.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class DeviceReference {

    /**
     * The IP address at which the device can be found.
     */
    @API(status = API.Status.STABLE)
    public final InetAddress address;

    /**
     * The port on which the device offers its service.
     */
    @API(status = API.Status.STABLE)
    public final int port;

    /**
     * We are immutable so we can precompute our hash code.
     */
    private final int hashcode;

    /**
     * Create a unique device identifier.
     *
     * @param address the IP address at which the device can be found
     * @param port the port on which the device offers its service
     */
    private DeviceReference(InetAddress address, int port) {
        this.address = address;
        this.port = port;
        hashcode = Objects.hash(address, port);
    }

    /**
     * Holds all the instances of this class as they get created by the static factory method.
     */
    private static final Map<InetAddress, Map<Integer, DeviceReference>> instances = new HashMap<>();

    /**
     * Get a unique device identifier by address and port.
     *
     * @param address the IP address at which the device can be found
     * @param port the port on which the device offers its service
     *
     * @return the reference uniquely identifying the device with that address and port
     */
    @API(status = API.Status.STABLE)
    public static synchronized DeviceReference getDeviceReference(InetAddress address, int port) {
        final Map<Integer, DeviceReference> portMap = instances.computeIfAbsent(address, k -> new HashMap<>());
        return portMap.computeIfAbsent(port, p -> new DeviceReference(address, p));
    }

    /**
     * Get a unique device identifier corresponding to a device that has been found.
     *
     * @param device the device that answered a probe
     *
     * @return the reference uniquely identifying that device
     */
    @API(status = API.Status.STABLE)
    public static DeviceReference getDeviceReference(Device device) {
        return getDeviceReference(device.getAddress(), device.getPort());
    }

    @Override
    public int hashCode() {
        return hashcode;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DeviceReference && ((DeviceReference) obj).port == port &&
                ((DeviceReference) obj).address.equals(address);
    }

    @Override
    public String toString() {
        return "DeviceReference[address:" + address.getHostAddress() + ", port:" + port + "]";
    }
}
