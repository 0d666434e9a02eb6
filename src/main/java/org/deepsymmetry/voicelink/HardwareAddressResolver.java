package org.deepsymmetry.voicelink;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeroturnaround.exec.ProcessExecutor;
import org.zeroturnaround.exec.ProcessResult;

import java.io.IOException;
import java.net.InetAddress;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Looks up the hardware (MAC) address of a host by asking the operating system's neighbor table, using the
 * {@code arp -a <address>} command which is available on Linux, macOS and Windows alike. This is strictly
 * best-effort: any failure simply means the address is unknown.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class HardwareAddressResolver {

    private static final Logger logger = LoggerFactory.getLogger(HardwareAddressResolver.class);

    /**
     * Six pairs of hex digits separated by colons or dashes.
     */
    private static final Pattern HARDWARE_ADDRESS = Pattern.compile("^([0-9A-Fa-f]{2}[:-]){5}[0-9A-Fa-f]{2}$");

    /**
     * The default number of milliseconds we allow the neighbor table command to run.
     */
    public static final long DEFAULT_LOOKUP_TIMEOUT = 2000;

    private final AtomicLong lookupTimeout = new AtomicLong(DEFAULT_LOOKUP_TIMEOUT);

    /**
     * Set how long the neighbor table command may run before we give up on it.
     *
     * @param timeout the maximum number of milliseconds to wait
     *
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    public void setLookupTimeout(long timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        lookupTimeout.set(timeout);
    }

    /**
     * Check how long the neighbor table command may run before we give up on it.
     *
     * @return the maximum number of milliseconds to wait
     */
    public long getLookupTimeout() {
        return lookupTimeout.get();
    }

    /**
     * Find the hardware address of a host which has recently been contacted, so it is likely to be present
     * in the neighbor table.
     *
     * @param address the host whose hardware address is desired
     *
     * @return the upper-case hardware address, or {@code null} if it could not be determined
     */
    @API(status = API.Status.STABLE)
    public String resolve(InetAddress address) {
        final String ip = address.getHostAddress();
        try {
            final ProcessResult result = new ProcessExecutor()
                    .command("arp", "-a", ip)
                    .readOutput(true)
                    .timeout(lookupTimeout.get(), TimeUnit.MILLISECONDS)
                    .exitValueAny()
                    .execute();
            final String found = findHardwareAddress(result.outputUTF8(), ip);
            if (found == null) {
                logger.debug("No hardware address listed for {}", ip);
            }
            return found;
        } catch (IOException | TimeoutException e) {
            logger.debug("Unable to look up hardware address of {}: {}", ip, e.toString());
        } catch (InterruptedException e) {
            logger.debug("Interrupted looking up hardware address of {}", ip);
            Thread.currentThread().interrupt();
        }
        return null;
    }

    /**
     * Scan the output of the neighbor table command for the hardware address of a particular host. Only lines
     * which mention exactly that address are considered, so that looking up {@code 10.0.0.4} cannot pick up the
     * entry for {@code 10.0.0.42}. Linux and macOS put the address in parentheses, Windows does not.
     *
     * @param output the text printed by the command
     * @param address the address whose entry is wanted
     *
     * @return the first well-formed hardware address on a matching line, in upper case, or {@code null}
     */
    static String findHardwareAddress(String output, String address) {
        if (output == null) {
            return null;
        }
        for (String line : output.split("\\R")) {
            final String[] tokens = line.trim().split("\\s+");
            boolean mentionsAddress = false;
            for (String token : tokens) {
                if (token.replace("(", "").replace(")", "").equals(address)) {
                    mentionsAddress = true;
                    break;
                }
            }
            if (mentionsAddress) {
                for (String token : tokens) {
                    if (HARDWARE_ADDRESS.matcher(token).matches()) {
                        return token.toUpperCase(Locale.ROOT);
                    }
                }
            }
        }
        return null;
    }
}
