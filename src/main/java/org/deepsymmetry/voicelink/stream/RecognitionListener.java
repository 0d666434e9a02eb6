package org.deepsymmetry.voicelink.stream;

import org.apiguardian.api.API;

/**
 * The listener interface for receiving recognition results from a connected device. Register it using
 * {@link ConnectionManager#addRecognitionListener(RecognitionListener)}.
 *
 * @since 0.1.0
 */
@API(status = API.Status.STABLE)
public interface RecognitionListener {

    /**
     * Invoked when the device reports the outcome of analyzing audio. Results are delivered on the same
     * thread as {@link ConnectionListener} events, so this must finish quickly.
     *
     * @param result what the device recognized
     */
    void recognitionResultReceived(RecognitionResult result);
}
