package org.deepsymmetry.voicelink;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.apiguardian.api.API;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * The descriptive information a device reports about itself from its {@value #INFO_PATH} endpoint: identification,
 * a snapshot of its system status, and what it can do with audio. Property names are matched without regard to
 * case, and the snake_case spellings used by the device back end are accepted too. Anything that cannot be
 * understood makes {@link #parse(String)} fail, so the device is treated as having no capabilities at all.
 */
@API(status = API.Status.STABLE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceCapabilities {

    /**
     * The path, on the service port, at which devices describe themselves.
     */
    @API(status = API.Status.STABLE)
    public static final String INFO_PATH = "/system/info";

    private static final ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @JsonProperty("name")
    @JsonAlias({"hostname", "device_name"})
    private String name;

    @JsonProperty("version")
    private String version;

    @JsonProperty("model")
    private String model;

    @JsonProperty("serialNumber")
    @JsonAlias({"serial_number", "serial"})
    private String serialNumber;

    @JsonProperty("status")
    private Status status;

    @JsonProperty("audio")
    private Audio audio;

    /**
     * Used by the JSON mapper.
     */
    private DeviceCapabilities() {
        // Fields are filled in by the mapper.
    }

    /**
     * Interpret the JSON document returned by a device's {@value #INFO_PATH} endpoint.
     *
     * @param json the response body
     *
     * @return the capabilities described by the document
     *
     * @throws IOException if the document is not valid JSON, is not an object, or has fields of the wrong type
     */
    @API(status = API.Status.STABLE)
    public static DeviceCapabilities parse(String json) throws IOException {
        final DeviceCapabilities result = mapper.readValue(json, DeviceCapabilities.class);
        if (result == null) {
            throw new IOException("Device information document was empty");
        }
        return result;
    }

    /**
     * @return the name the device reports for itself, may be {@code null}
     */
    public String getName() {
        return name;
    }

    /**
     * @return the software version running on the device, may be {@code null}
     */
    public String getVersion() {
        return version;
    }

    /**
     * @return the hardware model of the device, may be {@code null}
     */
    public String getModel() {
        return model;
    }

    /**
     * @return the serial number of the device, may be {@code null}
     */
    public String getSerialNumber() {
        return serialNumber;
    }

    /**
     * @return the status snapshot, or {@code null} if the device did not include one
     */
    public Status getStatus() {
        return status;
    }

    /**
     * @return the audio capabilities, or {@code null} if the device did not include them
     */
    public Audio getAudio() {
        return audio;
    }

    @Override
    public String toString() {
        return "DeviceCapabilities[name:" + name + ", version:" + version + ", model:" + model +
                ", serialNumber:" + serialNumber + ", status:" + status + ", audio:" + audio + "]";
    }

    /**
     * A snapshot of how busy and healthy the device was when it answered.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Status {

        @JsonProperty("cpuUsage")
        @JsonAlias("cpu_usage")
        private double cpuUsage;

        @JsonProperty("memoryUsage")
        @JsonAlias("memory_usage")
        private double memoryUsage;

        @JsonProperty("temperature")
        private double temperature;

        @JsonProperty("diskUsage")
        @JsonAlias("disk_usage")
        private double diskUsage;

        @JsonProperty("uptime")
        private String uptime;

        @JsonProperty("isRecording")
        @JsonAlias({"is_recording", "recording"})
        private boolean recording;

        @JsonProperty("activeConnections")
        @JsonAlias("active_connections")
        private int activeConnections;

        private Status() {
            // Fields are filled in by the mapper.
        }

        /**
         * @return the processor load, as a percentage
         */
        public double getCpuUsage() {
            return cpuUsage;
        }

        /**
         * @return the memory in use, as a percentage
         */
        public double getMemoryUsage() {
            return memoryUsage;
        }

        /**
         * @return the processor temperature in degrees Celsius
         */
        public double getTemperature() {
            return temperature;
        }

        /**
         * @return the disk space in use, as a percentage
         */
        public double getDiskUsage() {
            return diskUsage;
        }

        /**
         * @return how long the device has been running, as the device formats it, may be {@code null}
         */
        public String getUptime() {
            return uptime;
        }

        /**
         * @return {@code true} if the device was recording audio
         */
        public boolean isRecording() {
            return recording;
        }

        /**
         * @return how many clients were connected to the device
         */
        public int getActiveConnections() {
            return activeConnections;
        }

        @Override
        public String toString() {
            return "Status[cpuUsage:" + cpuUsage + ", memoryUsage:" + memoryUsage + ", temperature:" + temperature +
                    ", diskUsage:" + diskUsage + ", uptime:" + uptime + ", recording:" + recording +
                    ", activeConnections:" + activeConnections + "]";
        }
    }

    /**
     * What the device can do with audio.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Audio {

        @JsonProperty("supportedFormats")
        @JsonAlias("supported_formats")
        private List<String> supportedFormats = Collections.emptyList();

        @JsonProperty("supportedSampleRates")
        @JsonAlias("supported_sample_rates")
        private List<Integer> supportedSampleRates = Collections.emptyList();

        @JsonProperty("maxChannels")
        @JsonAlias("max_channels")
        private int maxChannels;

        @JsonProperty("audioDevice")
        @JsonAlias("audio_device")
        private String audioDevice;

        @JsonProperty("hasMicrophone")
        @JsonAlias("has_microphone")
        private boolean microphone;

        private Audio() {
            // Fields are filled in by the mapper.
        }

        /**
         * @return the audio formats the device accepts, such as {@code "wav"}
         */
        public List<String> getSupportedFormats() {
            return supportedFormats == null ? Collections.emptyList() : Collections.unmodifiableList(supportedFormats);
        }

        /**
         * @return the sample rates the device accepts, in Hz
         */
        public List<Integer> getSupportedSampleRates() {
            return supportedSampleRates == null ? Collections.emptyList() : Collections.unmodifiableList(supportedSampleRates);
        }

        /**
         * @return the largest number of audio channels the device handles
         */
        public int getMaxChannels() {
            return maxChannels;
        }

        /**
         * @return the name of the audio hardware on the device, may be {@code null}
         */
        public String getAudioDevice() {
            return audioDevice;
        }

        /**
         * @return {@code true} if the device has its own microphone
         */
        public boolean hasMicrophone() {
            return microphone;
        }

        @Override
        public String toString() {
            return "Audio[supportedFormats:" + supportedFormats + ", supportedSampleRates:" + supportedSampleRates +
                    ", maxChannels:" + maxChannels + ", audioDevice:" + audioDevice + ", microphone:" + microphone + "]";
        }
    }
}
