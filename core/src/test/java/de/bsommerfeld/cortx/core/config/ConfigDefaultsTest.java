package de.bsommerfeld.cortx.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void supervisorConfig_shouldPollEveryHundredMillis() {
        assertEquals(100, new SupervisorConfig().getPollIntervalMillis());
    }

    @Test
    void supervisorConfig_shouldHaveReasonableKillTimings() {
        var config = new SupervisorConfig();

        assertEquals(50, config.getShutdownGraceMillis());
        assertEquals(100, config.getKillEscalationDelayMillis());
        assertEquals(200, config.getKillRetryDelayMillis());
        assertEquals(1000, config.getOutputDrainTimeoutMillis());
    }

    @Test
    void supervisorConfig_shouldEnableEnvironmentTweaksByDefault() {
        var config = new SupervisorConfig();

        assertTrue(config.isForceUtf8Output());
        assertTrue(config.isEnrichPath());
    }

    @Test
    void supervisorConfig_shouldSupportToggles() {
        var config = new SupervisorConfig();
        config.setEnrichPath(false);
        config.setForceUtf8Output(false);

        assertFalse(config.isEnrichPath());
        assertFalse(config.isForceUtf8Output());
    }
}
