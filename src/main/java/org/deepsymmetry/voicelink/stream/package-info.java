/**
 * <p>Maintains a streaming connection to a device.</p>
 *
 * <p>The {@link org.deepsymmetry.voicelink.stream.ConnectionManager} opens the connection, keeps it alive with
 * heartbeats, and restores it when it is lost. Audio is sent to the device in binary frames, while text frames
 * carry JSON messages, encapsulated by the {@link org.deepsymmetry.voicelink.stream.Message} class and converted
 * by the {@link org.deepsymmetry.voicelink.stream.MessageCodec}. The known message types are found in
 * {@link org.deepsymmetry.voicelink.stream.Message.KnownType}.</p>
 */
package org.deepsymmetry.voicelink.stream;
