package de.bsommerfeld.cortx.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_shouldBeAbsolute() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.isAbsolute());
    }

    @Test
    void getAppDataDir_differentNames_shouldProduceDifferentPaths() {
        assertNotEquals(StorageUtils.getAppDataDir("app-one"), StorageUtils.getAppDataDir("app-two"));
    }

    @Test
    void getConfigFile_shouldDefaultToConfigJsonInAppDataDir() {
        String original = System.getProperty("cortx.config");
        try {
            System.clearProperty("cortx.config");
            Path file = StorageUtils.getConfigFile("test-app");
            assertEquals(StorageUtils.getAppDataDir("test-app").resolve("config.json"), file);
        } finally {
            if (original != null)
                System.setProperty("cortx.config", original);
        }
    }

    @Test
    void getConfigFile_shouldHonorSystemPropertyOverride() {
        String original = System.getProperty("cortx.config");
        try {
            System.setProperty("cortx.config", "custom/settings.json");
            Path file = StorageUtils.getConfigFile("test-app");
            assertTrue(file.isAbsolute());
            assertTrue(file.endsWith(Path.of("custom", "settings.json")));
        } finally {
            if (original != null)
                System.setProperty("cortx.config", original);
            else
                System.clearProperty("cortx.config");
        }
    }
}
