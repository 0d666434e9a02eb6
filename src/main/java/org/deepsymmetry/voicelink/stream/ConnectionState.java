package org.deepsymmetry.voicelink.stream;

import org.apiguardian.api.API;

/**
 * The states through which a {@link ConnectionManager} moves.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public enum ConnectionState {
    /**
     * No connection exists or is being attempted. This is where every manager starts, and where it settles
     * after an explicit disconnect, a failed connect, or running out of reconnection attempts.
     */
    DISCONNECTED,
    /**
     * A connection requested by the caller is being opened.
     */
    CONNECTING,
    /**
     * The streaming connection is open and the heartbeat is running.
     */
    CONNECTED,
    /**
     * An explicit disconnect is closing the connection.
     */
    DISCONNECTING,
    /**
     * The connection was lost without being asked to close, and new connections are being attempted to the
     * same host and port.
     */
    RECONNECTING
}
