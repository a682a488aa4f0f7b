package de.bsommerfeld.cortx.supervisor.termination;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class SystemCommandRunnerTest {

    @Test
    void run_shouldCaptureExitCodeAndBothStreams() throws Exception {
        CommandResult result = new SystemCommandRunner()
                .run(List.of("sh", "-c", "echo out; echo err >&2; exit 3"));

        assertEquals(3, result.exitCode());
        assertFalse(result.isSuccess());
        assertEquals("out", result.stdout().strip());
        assertEquals("err", result.stderr().strip());
    }

    @Test
    void run_shouldTimeOutWhileUtilityKeepsOutputOpen() {
        SystemCommandRunner runner = new SystemCommandRunner(1);
        long start = System.nanoTime();

        var e = assertThrows(IOException.class, () -> runner.run(List.of("sleep", "20")));

        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        assertTrue(elapsedMillis < 10_000, "timeout ignored, took " + elapsedMillis + " ms");
        assertTrue(e.getMessage().contains("did not finish"));
    }

    @Test
    void run_shouldFailForMissingUtility() {
        assertThrows(IOException.class, () -> new SystemCommandRunner().run(List.of("/nonexistent/kill")));
    }
}
