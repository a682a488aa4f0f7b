package de.bsommerfeld.cortx.app;

import de.bsommerfeld.cortx.supervisor.ExecutionMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CortxOptionsTest {

    @Test
    void parse_shouldDefaultToSequentialInCurrentDirectory() {
        CortxOptions options = CortxOptions.parse(new String[] { "make build", "make test" });

        assertEquals(ExecutionMode.SEQUENTIAL, options.mode());
        assertFalse(options.stopOnFailure());
        assertEquals(Path.of(System.getProperty("user.dir")), options.workingDirectory());
        assertEquals(List.of("make build", "make test"), options.commands());
    }

    @Test
    void parse_shouldReadAllOptions() {
        CortxOptions options = CortxOptions.parse(
                new String[] { "--parallel", "--stop-on-failure", "--cwd", "/srv/app", "npm start" });

        assertEquals(ExecutionMode.PARALLEL, options.mode());
        assertTrue(options.stopOnFailure());
        assertEquals(Path.of("/srv/app"), options.workingDirectory());
        assertEquals(List.of("npm start"), options.commands());
    }

    @Test
    void parse_shouldTreatEverythingAfterDoubleDashAsCommands() {
        CortxOptions options = CortxOptions.parse(new String[] { "--", "--parallel" });

        assertEquals(ExecutionMode.SEQUENTIAL, options.mode());
        assertEquals(List.of("--parallel"), options.commands());
    }

    @Test
    void parse_shouldRejectUnknownOption() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> CortxOptions.parse(new String[] { "--verbose", "ls" }));
        assertTrue(e.getMessage().contains("--verbose"));
    }

    @Test
    void parse_shouldRejectMissingCwdValue() {
        assertThrows(IllegalArgumentException.class, () -> CortxOptions.parse(new String[] { "ls", "--cwd" }));
    }

    @Test
    void parse_shouldRejectEmptyCommandList() {
        assertThrows(IllegalArgumentException.class, () -> CortxOptions.parse(new String[] { "--parallel" }));
    }
}
