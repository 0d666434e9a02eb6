package org.deepsymmetry.voicelink;

import org.apiguardian.api.API;

import java.net.InetAddress;

/**
 * Determines whether a single address or host name runs the device service. Probing happens in two phases: the
 * probe methods stop as soon as the service handshake succeeds, so the device can be announced right away, and
 * {@link #describe(Device)} then gathers the optional details, which may take much longer. Implementations must
 * bound every step with its own timeout, and must be safe to call from many threads at once, since discovery
 * probes a whole subnet concurrently.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public interface HostProbe {

    /**
     * Probe an address found by scanning a subnet: check that it is reachable, then perform the service
     * handshake.
     *
     * @param address the candidate address
     *
     * @return the device found there, without optional details, or {@code null} if the address did not answer
     *         the handshake
     */
    @API(status = API.Status.STABLE)
    Device probeAddress(InetAddress address);

    /**
     * Probe a host name by resolving it to an address and performing the service handshake there.
     *
     * @param hostname the name to resolve
     *
     * @return the device found there, without optional details, or {@code null} if the name could not be
     *         resolved or did not answer
     */
    @API(status = API.Status.STABLE)
    Device probeHostname(String hostname);

    /**
     * Gather the optional details of a device which has answered the handshake: what it reports about itself,
     * and its hardware address. Nothing found here can disqualify the device.
     *
     * @param device a device returned by one of the probe methods
     *
     * @return a device with the same address, port and host name, carrying whatever details could be found
     */
    @API(status = API.Status.STABLE)
    Device describe(Device device);
}
