package org.deepsymmetry.voicelink.stream;

/**
 * <p>An abstract adapter class for following connection events. The methods in this class are empty; it exists as a
 * convenience for creating listener objects.</p>
 *
 * <p>Extend this class to create a {@link ConnectionListener} and override only the methods for events that you
 * care about.</p>
 *
 * @since 0.1.0
 */
public abstract class ConnectionAdapter implements ConnectionListener {

    @Override
    public void stateChanged(ConnectionState oldState, ConnectionState newState) {

    }

    @Override
    public void errorOccurred(String message, Throwable cause) {

    }

    @Override
    public void reconnectFailed(int attempts) {

    }
}
