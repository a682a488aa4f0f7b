package de.bsommerfeld.cortx.supervisor;

import de.bsommerfeld.cortx.core.config.SupervisorConfig;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Prepares the environment of a {@link ProcessBuilder} before spawn.
 *
 * <p>
 * The builder starts with the supervisor's own environment. On top of that:
 * <ul>
 * <li>on Windows, Python children are forced to write UTF-8 so their output
 * decodes cleanly ({@code PYTHONUTF8}, {@code PYTHONIOENCODING})</li>
 * <li>elsewhere, {@code PATH} is extended with common user install locations,
 * which packaged launchers strip from their environment</li>
 * <li>the launch's explicit overrides are applied last and always win</li>
 * </ul>
 */
final class ProcessEnvironment {

    private static final List<String> EXTRA_PATHS = List.of(
            "/usr/local/bin",
            "/opt/homebrew/bin",
            "/opt/homebrew/sbin");

    private final boolean forceUtf8;
    private final boolean enrichPath;
    private final boolean windows;

    ProcessEnvironment(SupervisorConfig config) {
        this(config.isForceUtf8Output(), config.isEnrichPath(),
                System.getProperty("os.name", "").toLowerCase().contains("win"));
    }

    ProcessEnvironment(boolean forceUtf8, boolean enrichPath, boolean windows) {
        this.forceUtf8 = forceUtf8;
        this.enrichPath = enrichPath;
        this.windows = windows;
    }

    void apply(Map<String, String> environment, Map<String, String> overrides) {
        if (windows && forceUtf8) {
            environment.put("PYTHONUTF8", "1");
            environment.put("PYTHONIOENCODING", "utf-8");
        }
        if (!windows && enrichPath) {
            environment.put("PATH", enrich(environment.getOrDefault("PATH", "/usr/bin:/bin")));
        }
        environment.putAll(overrides);
    }

    private static String enrich(String path) {
        List<String> entries = new ArrayList<>(Arrays.asList(path.split(File.pathSeparator)));
        List<String> extras = new ArrayList<>(EXTRA_PATHS);
        extras.add(System.getProperty("user.home") + "/.local/bin");

        StringBuilder enriched = new StringBuilder(path);
        for (String extra : extras) {
            if (!entries.contains(extra)) {
                enriched.append(':').append(extra);
                entries.add(extra);
            }
        }
        return enriched.toString();
    }
}
