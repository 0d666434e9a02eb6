package org.deepsymmetry.voicelink;

import org.apiguardian.api.API;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable IPv4 network attached to this machine, identified by its network address and prefix length
 * (CIDR notation), from which candidate device addresses can be generated.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class Subnet {

    /**
     * The first host number within the last octet that we will probe.
     */
    public static final int FIRST_HOST = 1;

    /**
     * The last host number within the last octet that we will probe.
     */
    public static final int LAST_HOST = 254;

    /**
     * The address of the network itself, with all host bits cleared.
     */
    private final Inet4Address networkAddress;

    /**
     * The number of leading bits which identify the network.
     */
    private final int prefixLength;

    /**
     * Create a subnet from its already-computed network address and prefix length.
     *
     * @param networkAddress the address with the host bits cleared
     * @param prefixLength the number of bits that identify the network
     */
    private Subnet(Inet4Address networkAddress, int prefixLength) {
        this.networkAddress = networkAddress;
        this.prefixLength = prefixLength;
    }

    /**
     * Compute the subnet that contains an address, given the subnet mask in effect for that address.
     * The network address is found by masking the address bytes, and the prefix length by counting
     * the bits set in the mask.
     *
     * @param address an address on the subnet
     * @param mask the four bytes of the subnet mask
     *
     * @return the subnet containing that address
     *
     * @throws IllegalArgumentException if the mask is not four bytes long
     */
    @API(status = API.Status.STABLE)
    public static Subnet fromMask(Inet4Address address, byte[] mask) {
        if (mask.length != 4) {
            throw new IllegalArgumentException("IPv4 subnet mask must be 4 bytes long, got " + mask.length);
        }
        final byte[] addressBytes = address.getAddress();
        final byte[] networkBytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            networkBytes[i] = (byte) (addressBytes[i] & mask[i]);
        }
        return new Subnet(toInet4Address(networkBytes), Util.maskToPrefixLength(mask));
    }

    /**
     * Compute the subnet that contains an address, given the network prefix length in effect for that address.
     *
     * @param address an address on the subnet
     * @param prefixLength the number of bits that identify the network
     *
     * @return the subnet containing that address
     */
    @API(status = API.Status.STABLE)
    public static Subnet fromPrefixLength(Inet4Address address, int prefixLength) {
        return fromMask(address, Util.prefixLengthToMask(prefixLength));
    }

    /**
     * Get the network address of the subnet.
     *
     * @return the address with all host bits cleared
     */
    @API(status = API.Status.STABLE)
    public Inet4Address getNetworkAddress() {
        return networkAddress;
    }

    /**
     * Get the number of bits that identify the network.
     *
     * @return the CIDR prefix length
     */
    @API(status = API.Status.STABLE)
    public int getPrefixLength() {
        return prefixLength;
    }

    /**
     * Generate the addresses worth probing for devices. This keeps the first three octets of the network
     * address and substitutes host numbers {@value #FIRST_HOST} through {@value #LAST_HOST} in the last one.
     * Broadcast and network addresses of smaller subnets are not skipped; probes of them simply fail.
     *
     * @return the candidate host addresses, in ascending order
     */
    @API(status = API.Status.STABLE)
    public List<Inet4Address> hostCandidates() {
        final byte[] base = networkAddress.getAddress();
        final List<Inet4Address> result = new ArrayList<>(LAST_HOST - FIRST_HOST + 1);
        for (int host = FIRST_HOST; host <= LAST_HOST; host++) {
            result.add(toInet4Address(new byte[] {base[0], base[1], base[2], (byte) host}));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Convert four raw bytes into an IPv4 address without any name service lookup.
     *
     * @param bytes the address bytes
     *
     * @return the corresponding address
     */
    private static Inet4Address toInet4Address(byte[] bytes) {
        try {
            return (Inet4Address) InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            // Only thrown for an illegal length, and we always supply four bytes.
            throw new IllegalStateException("Unable to build IPv4 address", e);
        }
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Subnet && ((Subnet) obj).prefixLength == prefixLength &&
                ((Subnet) obj).networkAddress.equals(networkAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(networkAddress, prefixLength);
    }

    @Override
    public String toString() {
        return networkAddress.getHostAddress() + "/" + prefixLength;
    }
}
