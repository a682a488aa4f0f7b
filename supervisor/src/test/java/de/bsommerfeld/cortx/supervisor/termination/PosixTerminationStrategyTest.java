package de.bsommerfeld.cortx.supervisor.termination;

import de.bsommerfeld.cortx.supervisor.exception.KillFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Uses a PID far above any real one so that no actual process is touched.
 */
class PosixTerminationStrategyTest {

    private static final long PID = 999_999_999L;

    private CommandRunner runner;
    private PosixTerminationStrategy strategy;

    @BeforeEach
    void setUp() throws IOException {
        runner = mock(CommandRunner.class);
        when(runner.run(any())).thenReturn(CommandResult.ok(""));
        strategy = new PosixTerminationStrategy(runner, 0);
    }

    @Test
    void kill_shouldSendTermThenKillToProcessGroup() throws Exception {
        strategy.kill(PID);

        InOrder order = inOrder(runner);
        order.verify(runner).run(List.of("kill", "-TERM", "-" + PID));
        order.verify(runner).run(List.of("kill", "-KILL", "-" + PID));
    }

    @Test
    void kill_shouldIgnoreMissingProcessGroup() throws Exception {
        when(runner.run(List.of("kill", "-KILL", "-" + PID)))
                .thenReturn(CommandResult.failed(1, "kill: (-999999999) - No such process"));

        assertDoesNotThrow(() -> strategy.kill(PID));
    }

    @Test
    void kill_shouldFailWhenKillErrorsAndProcessSurvives() throws Exception {
        when(runner.run(List.of("kill", "-KILL", "-" + PID)))
                .thenReturn(CommandResult.failed(1, "Operation not permitted"));
        when(runner.run(List.of("kill", "-0", String.valueOf(PID)))).thenReturn(CommandResult.ok(""));

        var e = assertThrows(KillFailedException.class, () -> strategy.kill(PID));
        assertEquals(PID, e.getPid());
        assertTrue(e.getMessage().contains("Operation not permitted"));
    }

    @Test
    void kill_shouldNotFailWhenProcessIsGoneAnyway() throws Exception {
        when(runner.run(List.of("kill", "-KILL", "-" + PID)))
                .thenReturn(CommandResult.failed(1, "Operation not permitted"));
        when(runner.run(List.of("kill", "-0", String.valueOf(PID)))).thenReturn(CommandResult.failed(1, ""));

        assertDoesNotThrow(() -> strategy.kill(PID));
    }

    @Test
    void kill_shouldWrapRunnerFailure() throws Exception {
        when(runner.run(any())).thenThrow(new IOException("no kill binary"));

        var e = assertThrows(KillFailedException.class, () -> strategy.kill(PID));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void killRobustly_shouldRetryAndSweepChildrenWhenStillAlive() throws Exception {
        when(runner.run(List.of("kill", "-0", String.valueOf(PID)))).thenReturn(CommandResult.ok(""));

        strategy.killRobustly(PID);

        verify(runner).run(List.of("kill", "-KILL", String.valueOf(PID)));
        verify(runner).run(List.of("pkill", "-KILL", "-P", String.valueOf(PID)));
    }

    @Test
    void killRobustly_shouldSkipRetryWhenProcessIsGone() throws Exception {
        when(runner.run(List.of("kill", "-0", String.valueOf(PID)))).thenReturn(CommandResult.failed(1, ""));

        strategy.killRobustly(PID);

        verify(runner, never()).run(List.of("kill", "-KILL", String.valueOf(PID)));
        verify(runner).run(List.of("pkill", "-KILL", "-P", String.valueOf(PID)));
    }

    @Test
    void killRobustly_shouldNeverThrow() throws Exception {
        when(runner.run(any())).thenThrow(new IOException("broken"));

        assertDoesNotThrow(() -> strategy.killRobustly(PID));
    }
}
