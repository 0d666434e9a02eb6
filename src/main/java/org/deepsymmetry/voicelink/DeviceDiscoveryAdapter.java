package org.deepsymmetry.voicelink;

import java.util.Set;

/**
 * <p>An abstract adapter class for receiving discovery results. The methods in this class are empty; it exists as a
 * convenience for creating listener objects.</p>
 *
 * <p>Extend this class to create a {@link DeviceDiscoveryListener} and override only the methods for events that you
 * care about. If you plan to implement all the methods in the interface, you might as well implement
 * {@link DeviceDiscoveryListener} directly.</p>
 *
 * @since 0.1.0
 */
public abstract class DeviceDiscoveryAdapter implements DeviceDiscoveryListener {

    @Override
    public void deviceDiscovered(Device device) {

    }

    @Override
    public void discoveryCompleted(Set<Device> devices) {

    }
}
