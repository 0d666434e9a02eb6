package org.deepsymmetry.voicelink.stream;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apiguardian.api.API;
import org.deepsymmetry.voicelink.Util;

import java.time.Instant;
import java.util.Arrays;

/**
 * The outcome of a device analyzing a stretch of audio it was sent: who it thinks was speaking, how sure it is,
 * and optionally the acoustic features it measured. Delivered in the data of a
 * {@link Message.KnownType#RECOGNITION_RESULT} message.
 */
@API(status = API.Status.STABLE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecognitionResult {

    @JsonProperty("speaker_id")
    private String speakerId;

    @JsonProperty("speaker_name")
    @JsonAlias("speaker")
    private String speakerName;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("audio_duration")
    private double audioDuration;

    @JsonProperty("processing_time")
    private double processingTime;

    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("features")
    private Features features;

    private RecognitionResult() {
        // Fields are filled in by the mapper.
    }

    /**
     * @return the identifier of the recognized speaker, or {@code null} if nobody was recognized
     */
    public String getSpeakerId() {
        return speakerId;
    }

    /**
     * @return the name of the recognized speaker, which devices report as {@code "Unknown"} when unsure
     */
    public String getSpeakerName() {
        return speakerName;
    }

    /**
     * @return how sure the device is of the match, from 0 to 100
     */
    public double getConfidence() {
        return confidence;
    }

    /**
     * Get the time at which the device produced the result. Times without a zone offset are taken to be UTC.
     *
     * @return the time of the result, or {@code null} if it was missing or could not be understood
     */
    public Instant getTimestamp() {
        return Util.parseTimestamp(timestamp);
    }

    /**
     * @return how many seconds of audio were analyzed
     */
    public double getAudioDuration() {
        return audioDuration;
    }

    /**
     * @return how many seconds the device spent on the analysis
     */
    public double getProcessingTime() {
        return processingTime;
    }

    /**
     * @return the identifier of the device that produced the result, may be {@code null}
     */
    public String getDeviceId() {
        return deviceId;
    }

    /**
     * @return the acoustic features measured, or {@code null} if the device did not send them
     */
    public Features getFeatures() {
        return features;
    }

    @Override
    public String toString() {
        return "RecognitionResult[speakerId:" + speakerId + ", speakerName:" + speakerName +
                ", confidence:" + confidence + ", timestamp:" + timestamp + ", audioDuration:" + audioDuration +
                ", processingTime:" + processingTime + ", deviceId:" + deviceId + ", features:" + features + "]";
    }

    /**
     * The acoustic measurements behind a recognition.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Features {

        @JsonProperty("mfcc_features")
        private double[] mfccFeatures;

        @JsonProperty("energy_level")
        private double energyLevel;

        @JsonProperty("voice_activity")
        private boolean voiceActivity;

        @JsonProperty("frequency_stats")
        private FrequencyStats frequencyStats;

        private Features() {
            // Fields are filled in by the mapper.
        }

        /**
         * @return a copy of the cepstral coefficient vector, empty if none was sent
         */
        public double[] getMfccFeatures() {
            return mfccFeatures == null ? new double[0] : mfccFeatures.clone();
        }

        public double getEnergyLevel() {
            return energyLevel;
        }

        public boolean isVoiceActivity() {
            return voiceActivity;
        }

        /**
         * @return the frequency statistics, or {@code null} if the device did not send them
         */
        public FrequencyStats getFrequencyStats() {
            return frequencyStats;
        }

        @Override
        public String toString() {
            return "Features[mfccFeatures:" + Arrays.toString(mfccFeatures) + ", energyLevel:" + energyLevel +
                    ", voiceActivity:" + voiceActivity + ", frequencyStats:" + frequencyStats + "]";
        }
    }

    /**
     * Summary statistics of the spectrum of the analyzed audio, all in Hz.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FrequencyStats {

        @JsonProperty("fundamental_frequency")
        private double fundamentalFrequency;

        @JsonProperty("spectral_centroid")
        private double spectralCentroid;

        @JsonProperty("spectral_bandwidth")
        private double spectralBandwidth;

        @JsonProperty("spectral_rolloff")
        private double spectralRolloff;

        private FrequencyStats() {
            // Fields are filled in by the mapper.
        }

        public double getFundamentalFrequency() {
            return fundamentalFrequency;
        }

        public double getSpectralCentroid() {
            return spectralCentroid;
        }

        public double getSpectralBandwidth() {
            return spectralBandwidth;
        }

        public double getSpectralRolloff() {
            return spectralRolloff;
        }

        @Override
        public String toString() {
            return "FrequencyStats[fundamentalFrequency:" + fundamentalFrequency +
                    ", spectralCentroid:" + spectralCentroid + ", spectralBandwidth:" + spectralBandwidth +
                    ", spectralRolloff:" + spectralRolloff + "]";
        }
    }
}
