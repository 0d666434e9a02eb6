package org.deepsymmetry.voicelink.stream;

import org.apiguardian.api.API;

/**
 * The listener interface for following what happens to a {@link ConnectionManager}'s connection. Classes that are
 * interested can either implement this interface (and all the methods it contains) or extend the abstract
 * {@link ConnectionAdapter} class (overriding only the methods of interest), and register the resulting object
 * using {@link ConnectionManager#addConnectionListener(ConnectionListener)}.
 *
 * <p>Events are delivered in order on a single background thread owned by the manager. Any code in these
 * methods must finish quickly, or later events will back up behind it.</p>
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public interface ConnectionListener {

    /**
     * Invoked whenever the connection moves from one state to another.
     *
     * @param oldState the state being left
     * @param newState the state being entered
     */
    void stateChanged(ConnectionState oldState, ConnectionState newState);

    /**
     * Invoked when something goes wrong: a connection attempt fails, the connection is lost, or the device
     * sends an error message.
     *
     * @param message a description of the problem
     * @param cause the exception behind the problem, or {@code null} if there was none
     */
    void errorOccurred(String message, Throwable cause);

    /**
     * Invoked when the connection was lost and could not be restored. The manager is then disconnected, and
     * stays that way until asked to connect again.
     *
     * @param attempts how many reconnection attempts were made
     */
    void reconnectFailed(int attempts);
}
