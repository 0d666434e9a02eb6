package org.deepsymmetry.voicelink.stream;

import org.apiguardian.api.API;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Opens streaming connections to devices.
 */
@API(status = API.Status.STABLE)
@FunctionalInterface
public interface TransportFactory {

    /**
     * Start opening a connection.
     *
     * @param uri the streaming endpoint of the device
     * @param connectTimeout how long the network connection itself may take to establish
     * @param listener will receive everything that arrives once the connection is open
     *
     * @return a future which completes with the open transport, or exceptionally if the connection fails
     */
    CompletableFuture<Transport> open(URI uri, Duration connectTimeout, TransportListener listener);
}
