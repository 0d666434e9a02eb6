package org.deepsymmetry.voicelink;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Works out where on the local network devices might be found: the IPv4 subnets attached to the network
 * interfaces of this machine, and a short list of host names that devices commonly answer to.
 * Nothing here touches the network beyond inspecting the local interfaces.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class AddressSpaceEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(AddressSpaceEnumerator.class);

    /**
     * The host names that are probed during every discovery, because devices are often set up to answer to them.
     */
    @API(status = API.Status.STABLE)
    public static final List<String> DEFAULT_HOSTNAMES = List.of(
            "raspberrypi.local",
            "raspberrypi",
            "voicerecog.local",
            "voice-pi.local",
            "pi.local");

    /**
     * The host names currently being probed.
     */
    private final AtomicReference<List<String>> wellKnownHostnames = new AtomicReference<>(DEFAULT_HOSTNAMES);

    /**
     * Find the IPv4 subnets attached to all network interfaces that are up and are not loopback interfaces.
     * Each subnet is reported once, even if several interfaces or addresses share it.
     *
     * @return the subnets which can be scanned for devices, in the order the interfaces were listed
     *
     * @throws SocketException if the network interfaces cannot be examined
     */
    @API(status = API.Status.STABLE)
    public List<Subnet> enumerateSubnets() throws SocketException {
        final Set<Subnet> result = new LinkedHashSet<>();
        for (NetworkInterface networkInterface : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            if (!networkInterface.isUp() || networkInterface.isLoopback()) {
                continue;
            }
            for (InterfaceAddress address : networkInterface.getInterfaceAddresses()) {
                if (address == null) {
                    // This should never happen, but protects against a Windows Java bug, see
                    // https://bugs.java.com/bugdatabase/view_bug?bug_id=8023649
                    logger.warn("Received a null InterfaceAddress from {}, ignoring it.", networkInterface.getName());
                } else if (address.getAddress() instanceof Inet4Address) {
                    final Subnet subnet = Subnet.fromPrefixLength((Inet4Address) address.getAddress(),
                            address.getNetworkPrefixLength());
                    if (result.add(subnet)) {
                        logger.debug("Found subnet {} on interface {}", subnet, networkInterface.getName());
                    }
                }
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Get the host names which are probed directly during discovery, in addition to the subnet scan.
     *
     * @return the well-known device host names
     */
    @API(status = API.Status.STABLE)
    public List<String> getWellKnownHostnames() {
        return wellKnownHostnames.get();
    }

    /**
     * Replace the host names which are probed directly during discovery. The defaults are
     * {@link #DEFAULT_HOSTNAMES}.
     *
     * @param hostnames the host names to probe, may be empty but not {@code null}
     *
     * @throws IllegalArgumentException if {@code hostnames} is {@code null}
     */
    @API(status = API.Status.STABLE)
    public void setWellKnownHostnames(Collection<String> hostnames) {
        if (hostnames == null) {
            throw new IllegalArgumentException("hostnames must not be null");
        }
        wellKnownHostnames.set(List.copyOf(hostnames));
    }
}
