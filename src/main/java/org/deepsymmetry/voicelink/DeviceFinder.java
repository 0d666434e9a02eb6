package org.deepsymmetry.voicelink;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Finds devices on the local network by brute force: every candidate address on each attached subnet is probed,
 * along with a few well-known host names, and the hosts which answer the service handshake are reported.
 * Probes run concurrently, but each subnet is worked through in batches so that only a bounded number of
 * sockets are open at once. Only one discovery can run at a time on a given instance.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public class DeviceFinder {

    private static final Logger logger = LoggerFactory.getLogger(DeviceFinder.class);

    /**
     * The default number of milliseconds a discovery may run before unfinished probes are abandoned.
     */
    public static final long DEFAULT_DISCOVERY_TIMEOUT = 120000;

    /**
     * The default number of address probes which run at the same time while scanning a subnet.
     */
    public static final int DEFAULT_BATCH_SIZE = 50;

    /**
     * Works out which subnets and host names to probe.
     */
    private final AddressSpaceEnumerator enumerator;

    /**
     * Probes the individual candidates.
     */
    private final HostProbe probe;

    /**
     * Set while a discovery is in progress, so another cannot start.
     */
    private final AtomicBoolean discovering = new AtomicBoolean(false);

    /**
     * The results of the most recent discovery to complete.
     */
    private final AtomicReference<Set<Device>> lastDiscoveredDevices = new AtomicReference<>(Collections.emptySet());

    private final AtomicInteger batchSize = new AtomicInteger(DEFAULT_BATCH_SIZE);

    private final AtomicLong discoveryTimeout = new AtomicLong(DEFAULT_DISCOVERY_TIMEOUT);

    /**
     * Keeps track of the registered discovery listeners.
     */
    private final Set<DeviceDiscoveryListener> discoveryListeners =
            Collections.newSetFromMap(new ConcurrentHashMap<>());

    /**
     * Delivers discovery events to listeners, one at a time and in the order they happened.
     */
    private final ExecutorService eventDelivery = Util.newEventDeliveryExecutor("VoiceLink discovery events");

    /**
     * Create a device finder which probes the real network on the standard service port.
     */
    @API(status = API.Status.STABLE)
    public DeviceFinder() {
        this(new AddressSpaceEnumerator(), new NetworkHostProbe());
    }

    /**
     * Create a device finder with particular ways of choosing and probing candidates.
     *
     * @param enumerator works out which subnets and host names to probe
     * @param probe checks whether an individual candidate is a device
     *
     * @throws IllegalArgumentException if either argument is {@code null}
     */
    @API(status = API.Status.STABLE)
    public DeviceFinder(AddressSpaceEnumerator enumerator, HostProbe probe) {
        if (enumerator == null || probe == null) {
            throw new IllegalArgumentException("enumerator and probe must not be null");
        }
        this.enumerator = enumerator;
        this.probe = probe;
    }

    /**
     * Get the object which works out which subnets and host names are probed, so that the well-known
     * host names can be adjusted.
     *
     * @return the address space enumerator in use
     */
    @API(status = API.Status.STABLE)
    public AddressSpaceEnumerator getAddressSpaceEnumerator() {
        return enumerator;
    }

    /**
     * Check whether a discovery is currently running.
     *
     * @return {@code true} if {@link #discover()} has been called and has not yet returned
     */
    @API(status = API.Status.STABLE)
    public boolean isDiscovering() {
        return discovering.get();
    }

    /**
     * Get the devices which were found by the most recent discovery to complete.
     *
     * @return the devices, which will be empty if no discovery has yet completed
     */
    @API(status = API.Status.STABLE)
    public Set<Device> getLastDiscoveredDevices() {
        return lastDiscoveredDevices.get();
    }

    /**
     * Set how many address probes may run at the same time while scanning a subnet.
     *
     * @param size the number of probes in each batch
     *
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public void setBatchSize(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be positive");
        }
        batchSize.set(size);
    }

    /**
     * Check how many address probes may run at the same time while scanning a subnet.
     *
     * @return the number of probes in each batch
     */
    public int getBatchSize() {
        return batchSize.get();
    }

    /**
     * Set how long a discovery may run before unfinished probes are abandoned and the results found so far
     * are reported.
     *
     * @param timeout the maximum number of milliseconds a discovery may take
     *
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    public void setDiscoveryTimeout(long timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        discoveryTimeout.set(timeout);
    }

    /**
     * Check how long a discovery may run before unfinished probes are abandoned.
     *
     * @return the maximum number of milliseconds a discovery may take
     */
    public long getDiscoveryTimeout() {
        return discoveryTimeout.get();
    }

    /**
     * <p>Search the local network for devices. Every address on each attached subnet is probed, along with the
     * well-known host names, and this method returns once they have all been checked or the discovery timeout
     * has elapsed. A {@link DeviceDiscoveryListener#deviceDiscovered(Device)} event is sent as each device is found,
     * and a single {@link DeviceDiscoveryListener#discoveryCompleted(Set)} event is sent at the end, even if
     * nothing was found or the local interfaces could not be examined.</p>
     *
     * <p>If a discovery is already running, this one does nothing and returns an empty set.</p>
     *
     * @return the devices found, one per address and port
     */
    @API(status = API.Status.STABLE)
    public Set<Device> discover() {
        if (!discovering.compareAndSet(false, true)) {
            logger.warn("Discovery is already in progress, ignoring request to start another.");
            return Collections.emptySet();
        }
        final DiscoverySession session = new DiscoverySession();
        final ExecutorService workers = Executors.newCachedThreadPool(Util.daemonThreadFactory("VoiceLink probe"));
        Set<Device> result = Collections.emptySet();
        try {
            runSession(session, workers);
        } finally {
            workers.shutdownNow();
            result = session.close();
            lastDiscoveredDevices.set(result);
            discovering.set(false);
            logger.info("Discovery completed, found {} device(s).", result.size());
            deliverDiscoveryCompleted(result);
        }
        return result;
    }

    /**
     * Probe every subnet and well-known host name, waiting until all the probes are finished or the
     * discovery timeout elapses.
     *
     * @param session collects the devices that are found
     * @param workers runs the probes
     */
    private void runSession(final DiscoverySession session, final ExecutorService workers) {
        final List<Subnet> subnets;
        try {
            subnets = enumerator.enumerateSubnets();
        } catch (Exception e) {
            logger.error("Unable to examine local network interfaces, abandoning discovery.", e);
            return;
        }
        final List<String> hostnames = enumerator.getWellKnownHostnames();
        logger.info("Starting discovery of {} subnet(s) and {} host name(s).", subnets.size(), hostnames.size());

        final List<Callable<Void>> tasks = new ArrayList<>();
        for (final Subnet subnet : subnets) {
            tasks.add(() -> {
                scanSubnet(subnet, session, workers);
                return null;
            });
        }
        for (final String hostname : hostnames) {
            tasks.add(() -> {
                session.found(probeHostname(hostname));
                return null;
            });
        }
        try {
            workers.invokeAll(tasks, discoveryTimeout.get(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for discovery to finish, reporting devices found so far.");
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Probe every candidate address of a subnet, a batch at a time, so that no more than the configured
     * batch size of probes are ever in flight for the subnet.
     *
     * @param subnet the subnet to scan
     * @param session collects the devices that are found
     * @param workers runs the probes
     */
    private void scanSubnet(Subnet subnet, final DiscoverySession session, ExecutorService workers) {
        final List<Inet4Address> candidates = subnet.hostCandidates();
        final int size = batchSize.get();
        logger.debug("Scanning subnet {} in batches of {}", subnet, size);
        try {
            for (int start = 0; start < candidates.size(); start += size) {
                final List<Callable<Void>> batch = new ArrayList<>(size);
                for (final Inet4Address candidate : candidates.subList(start, Math.min(start + size, candidates.size()))) {
                    batch.add(() -> {
                        session.found(probeAddress(candidate));
                        return null;
                    });
                }
                workers.invokeAll(batch);
            }
        } catch (InterruptedException e) {
            logger.debug("Scan of subnet {} abandoned.", subnet);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Probe a single address, making sure a misbehaving probe cannot disturb the rest of the scan.
     *
     * @param address the candidate address
     *
     * @return the device found there, or {@code null}
     */
    private Device probeAddress(Inet4Address address) {
        try {
            return probe.probeAddress(address);
        } catch (Exception e) {
            logger.debug("Problem probing {}", address.getHostAddress(), e);
            return null;
        }
    }

    /**
     * Probe a single host name, making sure a misbehaving probe cannot disturb the rest of the discovery.
     *
     * @param hostname the host name to probe
     *
     * @return the device found there, or {@code null}
     */
    private Device probeHostname(String hostname) {
        if (hostname == null || hostname.isBlank()) {
            return null;
        }
        try {
            return probe.probeHostname(hostname.trim());
        } catch (Exception e) {
            logger.debug("Problem probing host name {}", hostname, e);
            return null;
        }
    }

    /**
     * Gather the optional details of a device that has answered the handshake. If that goes wrong, the device
     * is still worth knowing about as it is.
     *
     * @param device the device found by a probe
     *
     * @return the device with whatever details could be found
     */
    private Device describe(Device device) {
        try {
            final Device described = probe.describe(device);
            return described == null ? device : described;
        } catch (Exception e) {
            logger.debug("Problem describing {}", device, e);
            return device;
        }
    }

    /**
     * Check whether a single host name, typically one where a device was found before, currently answers
     * the service handshake, and if so, gather its details. This runs outside of any discovery, sends no events,
     * and never throws: any problem simply means the device was not found.
     *
     * @param hostname the host name to probe
     *
     * @return the device found there, or {@code null}
     */
    @API(status = API.Status.STABLE)
    public Device findDevice(String hostname) {
        final Device device = probeHostname(hostname);
        return device == null ? null : describe(device);
    }

    /**
     * Adds the specified discovery listener to receive events when devices are found and discoveries complete.
     * If {@code listener} is {@code null} or already present in the set of registered listeners, no exception
     * is thrown and no action is performed.
     *
     * @param listener the discovery listener to add
     */
    @API(status = API.Status.STABLE)
    public void addDeviceDiscoveryListener(DeviceDiscoveryListener listener) {
        if (listener != null) {
            discoveryListeners.add(listener);
        }
    }

    /**
     * Removes the specified discovery listener so that it no longer receives events. If {@code listener} is
     * {@code null} or not present in the set of registered listeners, no exception is thrown and no action
     * is performed.
     *
     * @param listener the discovery listener to remove
     */
    @API(status = API.Status.STABLE)
    public void removeDeviceDiscoveryListener(DeviceDiscoveryListener listener) {
        if (listener != null) {
            discoveryListeners.remove(listener);
        }
    }

    /**
     * Get the set of discovery listeners that are currently registered.
     *
     * @return the currently registered discovery listeners
     */
    @API(status = API.Status.STABLE)
    public Set<DeviceDiscoveryListener> getDeviceDiscoveryListeners() {
        // Make a copy so callers get an immutable snapshot of the current state.
        return Set.copyOf(discoveryListeners);
    }

    /**
     * Send a device discovered event to all registered listeners.
     *
     * @param device the device that was just found
     */
    private void deliverDeviceDiscovered(final Device device) {
        for (final DeviceDiscoveryListener listener : getDeviceDiscoveryListeners()) {
            eventDelivery.execute(() -> {
                try {
                    listener.deviceDiscovered(device);
                } catch (Throwable t) {
                    logger.warn("Problem delivering device discovered event to listener", t);
                }
            });
        }
    }

    /**
     * Send a discovery completed event to all registered listeners.
     *
     * @param devices everything the discovery found
     */
    private void deliverDiscoveryCompleted(final Set<Device> devices) {
        for (final DeviceDiscoveryListener listener : getDeviceDiscoveryListeners()) {
            eventDelivery.execute(() -> {
                try {
                    listener.discoveryCompleted(devices);
                } catch (Throwable t) {
                    logger.warn("Problem delivering discovery completed event to listener", t);
                }
            });
        }
    }

    /**
     * Merge two sightings of the same device, keeping whatever either of them learned. Separate probes of the
     * same device, by address and by host name, can finish in any order.
     *
     * @param older the device already recorded
     * @param newer the device just found or described
     *
     * @return a device carrying the details of both
     */
    static Device combine(Device older, Device newer) {
        return new Device(newer.getAddress(),
                newer.getHostname() != null ? newer.getHostname() : older.getHostname(),
                newer.getPort(),
                newer.getHardwareAddress() != null ? newer.getHardwareAddress() : older.getHardwareAddress(),
                newer.getCapabilities() != null ? newer.getCapabilities() : older.getCapabilities(),
                Math.max(older.getLastSeen(), newer.getLastSeen()));
    }

    /**
     * Collects the devices found by one call to {@link #discover()}. All the probe threads report here, so
     * the device map is guarded by a single lock. Events are queued for delivery while the lock is held, which
     * is quick, so that no device can be reported after the session has been closed.
     */
    private class DiscoverySession {

        private final Object lock = new Object();

        /**
         * The devices found so far, keyed by address and port.
         */
        private final Map<DeviceReference, Device> devices = new LinkedHashMap<>();

        /**
         * Set once the results have been collected; stragglers from abandoned probes are then ignored.
         */
        private boolean closed;

        /**
         * Handle the result of a probe: record the device, then gather its details and record it again with
         * them. Does nothing if the probe found nothing.
         *
         * @param device the device found, or {@code null}
         */
        void found(Device device) {
            if (device != null && add(device)) {
                update(describe(device));
            }
        }

        /**
         * Record a device which has just answered the handshake. A device at a new address and port is announced
         * right away. If the same device was already found by scanning, and is now found again through its host
         * name, the host name is added to the existing entry, but it is not announced again.
         *
         * @param device the device found
         *
         * @return {@code false} if the session has already been closed
         */
        boolean add(Device device) {
            final DeviceReference reference = device.getReference();
            synchronized (lock) {
                if (closed) {
                    logger.debug("Ignoring {} found after discovery completed", device);
                    return false;
                }
                final Device existing = devices.get(reference);
                if (existing == null) {
                    devices.put(reference, device);
                    logger.info("Discovered {}", device);
                    deliverDeviceDiscovered(device);
                } else {
                    if (existing.getHostname() == null && device.getHostname() != null) {
                        logger.debug("Found host name {} for {}", device.getHostname(), reference);
                    }
                    devices.put(reference, combine(existing, device));
                }
                return true;
            }
        }

        /**
         * Replace the entry for a device with one carrying its details, without announcing it again.
         *
         * @param device the device with its details
         */
        void update(Device device) {
            synchronized (lock) {
                if (closed) {
                    logger.debug("Ignoring details of {} gathered after discovery completed", device);
                    return;
                }
                final DeviceReference reference = device.getReference();
                final Device existing = devices.get(reference);
                devices.put(reference, existing == null ? device : combine(existing, device));
            }
        }

        /**
         * Stop accepting results and gather the ones that arrived.
         *
         * @return the devices found, in the order they were found
         */
        Set<Device> close() {
            synchronized (lock) {
                closed = true;
                return Collections.unmodifiableSet(new LinkedHashSet<>(devices.values()));
            }
        }
    }
}
