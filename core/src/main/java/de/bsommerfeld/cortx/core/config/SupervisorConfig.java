package de.bsommerfeld.cortx.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Tuning knobs of the process supervisor. Every field has a default so a
 * missing or partial {@code config.json} still yields a usable configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "poll-interval-millis", "shutdown-grace-millis", "kill-escalation-delay-millis",
        "kill-retry-delay-millis", "output-drain-timeout-millis", "force-utf8-output", "enrich-path" })
public class SupervisorConfig {

    // Exit-watch tick; trades CPU against how quickly exits are noticed
    @JsonProperty("poll-interval-millis")
    private long pollIntervalMillis = 100;

    @JsonProperty("shutdown-grace-millis")
    private long shutdownGraceMillis = 50;

    // SIGTERM -> SIGKILL gap of the basic kill
    @JsonProperty("kill-escalation-delay-millis")
    private long killEscalationDelayMillis = 100;

    // Pause before the robust kill retries a survivor
    @JsonProperty("kill-retry-delay-millis")
    private long killRetryDelayMillis = 200;

    @JsonProperty("output-drain-timeout-millis")
    private long outputDrainTimeoutMillis = 1000;

    // Sets PYTHONUTF8/PYTHONIOENCODING for children on Windows
    @JsonProperty("force-utf8-output")
    private boolean forceUtf8Output = true;

    @JsonProperty("enrich-path")
    private boolean enrichPath = true;

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public void setPollIntervalMillis(long pollIntervalMillis) {
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public long getShutdownGraceMillis() {
        return shutdownGraceMillis;
    }

    public void setShutdownGraceMillis(long shutdownGraceMillis) {
        this.shutdownGraceMillis = shutdownGraceMillis;
    }

    public long getKillEscalationDelayMillis() {
        return killEscalationDelayMillis;
    }

    public void setKillEscalationDelayMillis(long killEscalationDelayMillis) {
        this.killEscalationDelayMillis = killEscalationDelayMillis;
    }

    public long getKillRetryDelayMillis() {
        return killRetryDelayMillis;
    }

    public void setKillRetryDelayMillis(long killRetryDelayMillis) {
        this.killRetryDelayMillis = killRetryDelayMillis;
    }

    public long getOutputDrainTimeoutMillis() {
        return outputDrainTimeoutMillis;
    }

    public void setOutputDrainTimeoutMillis(long outputDrainTimeoutMillis) {
        this.outputDrainTimeoutMillis = outputDrainTimeoutMillis;
    }

    public boolean isForceUtf8Output() {
        return forceUtf8Output;
    }

    public void setForceUtf8Output(boolean forceUtf8Output) {
        this.forceUtf8Output = forceUtf8Output;
    }

    public boolean isEnrichPath() {
        return enrichPath;
    }

    public void setEnrichPath(boolean enrichPath) {
        this.enrichPath = enrichPath;
    }
}
