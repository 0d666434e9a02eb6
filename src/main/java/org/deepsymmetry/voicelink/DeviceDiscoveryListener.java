package org.deepsymmetry.voicelink;

import org.apiguardian.api.API;

import java.util.Set;

/**
 * The listener interface for receiving discovery results. Classes that are interested in knowing when devices
 * are found can either implement this interface (and all the methods it contains) or extend the abstract
 * {@link DeviceDiscoveryAdapter} class (overriding only the methods of interest). The listener object created
 * from that class is then registered using {@link DeviceFinder#addDeviceDiscoveryListener(DeviceDiscoveryListener)}.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public interface DeviceDiscoveryListener {

    /**
     * Invoked as soon as a device answers the service handshake, while the rest of the discovery is still
     * running, so a list can be populated incrementally. Each address and port is reported at most once per
     * discovery. The device reported here has not yet been asked about itself, so its capabilities and hardware
     * address are usually missing; the entry in the completed set carries whatever was found later.
     *
     * <p>Discovery events are delivered in order on a single background thread owned by the {@link DeviceFinder}.
     * Any code in this method must finish quickly, or later events will back up behind it.</p>
     *
     * @param device the device that answered the probe
     */
    @API(status = API.Status.STABLE)
    void deviceDiscovered(Device device);

    /**
     * Invoked once at the end of every discovery, whether or not anything was found, after all the
     * {@link #deviceDiscovered(Device)} events of that discovery.
     *
     * @param devices every device found, with exactly one entry per address and port
     */
    @API(status = API.Status.STABLE)
    void discoveryCompleted(Set<Device> devices);
}
