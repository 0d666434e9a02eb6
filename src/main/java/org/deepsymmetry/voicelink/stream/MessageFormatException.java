package org.deepsymmetry.voicelink.stream;

import java.io.IOException;

/**
 * Indicates that a text frame received from a device could not be understood as a message envelope.
 *
 * @since 0.1.0
 */
public class MessageFormatException extends IOException {

    /**
     * Create an exception describing what was wrong with a frame.
     *
     * @param message the description of the problem
     */
    public MessageFormatException(String message) {
        super(message);
    }

    /**
     * Create an exception describing what was wrong with a frame, and the problem that revealed it.
     *
     * @param message the description of the problem
     * @param cause the exception thrown while interpreting the frame
     */
    public MessageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
