package de.bsommerfeld.widgetd.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Daemon settings read from {@code daemon.toml} in the config directory. Every
 * key is optional.
 *
 * <pre>
 * debug-mode = true
 * log-file = "/tmp/eww.log"
 * socket-file = "/run/user/1000/eww.sock"
 * response-timeout-ms = 5000
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DaemonSettings {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("log-file")
    private String logFile;

    @JsonProperty("socket-file")
    private String socketFile;

    @JsonProperty("response-timeout-ms")
    private long responseTimeoutMs = 5000;

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public String getLogFile() {
        return logFile;
    }

    public String getSocketFile() {
        return socketFile;
    }

    public long getResponseTimeoutMs() {
        return responseTimeoutMs;
    }

    public Duration getResponseTimeout() {
        return Duration.ofMillis(responseTimeoutMs);
    }
}
