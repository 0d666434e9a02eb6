package org.deepsymmetry.voicelink;

import org.junit.Test;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.List;

import static org.junit.Assert.*;

public class SubnetTest {

    private static Inet4Address address(String text) throws Exception {
        return (Inet4Address) InetAddress.getByName(text);
    }

    @Test
    public void masksAddressAndCountsPrefix() throws Exception {
        Subnet subnet = Subnet.fromMask(address("192.168.1.37"), new byte[] {(byte) 255, (byte) 255, (byte) 255, 0});
        assertEquals(address("192.168.1.0"), subnet.getNetworkAddress());
        assertEquals(24, subnet.getPrefixLength());
        assertEquals("192.168.1.0/24", subnet.toString());
    }

    @Test
    public void widerMaskClearsMoreBits() throws Exception {
        Subnet subnet = Subnet.fromPrefixLength(address("10.20.30.40"), 16);
        assertEquals(address("10.20.0.0"), subnet.getNetworkAddress());
        assertEquals(16, subnet.getPrefixLength());
    }

    @Test
    public void generatesHostsOneThroughTwoFiftyFour() throws Exception {
        List<Inet4Address> candidates = Subnet.fromPrefixLength(address("10.0.0.42"), 24).hostCandidates();
        assertEquals(254, candidates.size());
        assertEquals(address("10.0.0.1"), candidates.get(0));
        assertEquals(address("10.0.0.42"), candidates.get(41));
        assertEquals(address("10.0.0.254"), candidates.get(253));
    }

    @Test
    public void equalSubnetsFromDifferentHosts() throws Exception {
        assertEquals(Subnet.fromPrefixLength(address("10.0.0.5"), 24),
                Subnet.fromPrefixLength(address("10.0.0.200"), 24));
        assertNotEquals(Subnet.fromPrefixLength(address("10.0.0.5"), 24),
                Subnet.fromPrefixLength(address("10.0.0.5"), 25));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsShortMask() throws Exception {
        Subnet.fromMask(address("10.0.0.5"), new byte[] {(byte) 255, 0});
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsImpossiblePrefix() throws Exception {
        Subnet.fromPrefixLength(address("10.0.0.5"), 33);
    }
}
