package de.bsommerfeld.cortx.supervisor.termination;

import com.google.common.io.CharStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.charset.Charset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Each run is bounded
 * by a timeout after which the utility is destroyed.
 */
public class SystemCommandRunner implements CommandRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SystemCommandRunner.class);
    private static final long DEFAULT_TIMEOUT_SECONDS = 10;

    private final long timeoutSeconds;

    public SystemCommandRunner() {
        this(DEFAULT_TIMEOUT_SECONDS);
    }

    public SystemCommandRunner(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public CommandResult run(List<String> command) throws IOException {
        LOG.debug("Running {}", command);
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        // Both pipes are drained on their own threads so the timeout applies even
        // to a utility that keeps its output open
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readQuietly(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readQuietly(process.getErrorStream()));
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException(command.get(0) + " did not finish within " + timeoutSeconds + " s");
            }
            return new CommandResult(process.exitValue(), stdout.get(timeoutSeconds, TimeUnit.SECONDS),
                    stderr.get(timeoutSeconds, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new InterruptedIOException("Interrupted while running " + command.get(0));
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Could not read output of " + command.get(0), e);
        }
    }

    private static String read(InputStream in) throws IOException {
        try (InputStreamReader reader = new InputStreamReader(in, Charset.defaultCharset())) {
            return CharStreams.toString(reader);
        }
    }

    private static String readQuietly(InputStream in) {
        try {
            return read(in);
        } catch (IOException e) {
            LOG.debug("Reading utility output failed", e);
            return "";
        }
    }
}
