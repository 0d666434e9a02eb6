package org.deepsymmetry.voicelink.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.*;

public class MessageCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void encodesPingWithoutData() throws Exception {
        Message ping = new Message("ping", null, Instant.parse("2024-05-01T08:00:00Z"));
        JsonNode encoded = mapper.readTree(MessageCodec.encode(ping));
        assertEquals("ping", encoded.get("type").asText());
        assertFalse(encoded.has("data"));
        assertEquals("2024-05-01T08:00:00Z", encoded.get("timestamp").asText());
    }

    @Test
    public void encodesData() throws Exception {
        Message message = new Message("config", mapper.readTree("{\"sample_rate\": 16000}"), null);
        JsonNode encoded = mapper.readTree(MessageCodec.encode(message));
        assertEquals(16000, encoded.get("data").get("sample_rate").asInt());
        assertTrue(encoded.get("timestamp").isTextual());
    }

    @Test
    public void decodesEnvelope() throws Exception {
        Message message = MessageCodec.decode(
                "{\"type\": \"pong\", \"data\": null, \"timestamp\": \"2024-05-01T08:00:00\"}");
        assertEquals("pong", message.type);
        assertEquals(Message.KnownType.PONG, message.knownType);
        assertNull(message.data);
        assertEquals(Instant.parse("2024-05-01T08:00:00Z"), message.timestamp);
    }

    @Test
    public void unknownTypeDecodesWithoutKnownType() throws Exception {
        Message message = MessageCodec.decode("{\"type\": \"status_update\", \"data\": {\"level\": 3}}");
        assertEquals("status_update", message.type);
        assertNull(message.knownType);
        assertNull(message.timestamp);
    }

    @Test(expected = MessageFormatException.class)
    public void rejectsMissingType() throws Exception {
        MessageCodec.decode("{\"data\": {}}");
    }

    @Test(expected = MessageFormatException.class)
    public void rejectsMalformedJson() throws Exception {
        MessageCodec.decode("{\"type\": ");
    }

    @Test(expected = MessageFormatException.class)
    public void rejectsNonObject() throws Exception {
        MessageCodec.decode("[\"ping\"]");
    }

    @Test
    public void decodesRecognitionResultObject() throws Exception {
        Message message = MessageCodec.decode("{\"type\": \"recognition_result\", \"data\": {" +
                "\"speaker_id\": 7, \"speaker_name\": \"Alice\", \"confidence\": 87.5," +
                "\"timestamp\": \"2024-05-01T08:00:01\", \"audio_duration\": 1.5, \"processing_time\": 0.12," +
                "\"features\": {\"mfcc_features\": [1.0, 2.0], \"energy_level\": 0.4, \"voice_activity\": true," +
                "\"frequency_stats\": {\"fundamental_frequency\": 180.5}}}}");
        RecognitionResult result = MessageCodec.decodeRecognitionResult(message);
        assertEquals("7", result.getSpeakerId());
        assertEquals("Alice", result.getSpeakerName());
        assertEquals(87.5, result.getConfidence(), 0.0001);
        assertEquals(Instant.parse("2024-05-01T08:00:01Z"), result.getTimestamp());
        assertEquals(1.5, result.getAudioDuration(), 0.0001);
        assertArrayEquals(new double[] {1.0, 2.0}, result.getFeatures().getMfccFeatures(), 0.0001);
        assertTrue(result.getFeatures().isVoiceActivity());
        assertEquals(180.5, result.getFeatures().getFrequencyStats().getFundamentalFrequency(), 0.0001);
    }

    @Test
    public void decodesRecognitionResultString() throws Exception {
        Message message = MessageCodec.decode("{\"type\": \"recognition_result\", " +
                "\"data\": \"{\\\"speaker\\\": \\\"Bob\\\", \\\"confidence\\\": 55}\"}");
        RecognitionResult result = MessageCodec.decodeRecognitionResult(message);
        assertEquals("Bob", result.getSpeakerName());
        assertNull(result.getFeatures());
    }

    @Test(expected = MessageFormatException.class)
    public void rejectsRecognitionResultWithoutData() throws Exception {
        MessageCodec.decodeRecognitionResult(MessageCodec.decode("{\"type\": \"recognition_result\"}"));
    }

    @Test
    public void findsErrorText() throws Exception {
        assertEquals("Model not loaded", MessageCodec.errorText(
                MessageCodec.decode("{\"type\": \"error\", \"data\": \"Model not loaded\"}")));
        assertEquals("Disk full", MessageCodec.errorText(
                MessageCodec.decode("{\"type\": \"error\", \"data\": {\"message\": \"Disk full\"}}")));
        assertEquals("Unknown error", MessageCodec.errorText(MessageCodec.decode("{\"type\": \"error\"}")));
    }
}
