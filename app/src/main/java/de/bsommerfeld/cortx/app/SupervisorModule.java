package de.bsommerfeld.cortx.app;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.cortx.core.config.ConfigLoader;
import de.bsommerfeld.cortx.core.config.SupervisorConfig;
import de.bsommerfeld.cortx.core.util.StorageUtils;
import de.bsommerfeld.cortx.supervisor.sink.CompositeSink;
import de.bsommerfeld.cortx.supervisor.sink.EventBusSink;
import de.bsommerfeld.cortx.supervisor.sink.LoggingSink;
import de.bsommerfeld.cortx.supervisor.sink.ProcessEventSink;
import de.bsommerfeld.cortx.supervisor.termination.CommandRunner;
import de.bsommerfeld.cortx.supervisor.termination.SystemCommandRunner;
import de.bsommerfeld.cortx.supervisor.termination.TerminationStrategies;
import de.bsommerfeld.cortx.supervisor.termination.TerminationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module wiring the supervisor with its configuration, the platform
 * termination strategy and the event sinks.
 *
 * <p>
 * Events are written to the log and posted on the
 * {@link de.bsommerfeld.cortx.core.event.ApplicationEventBus}, where front ends
 * subscribe to them.
 */
public class SupervisorModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(SupervisorModule.class);

    private final SupervisorConfig config;

    /** Loads the configuration from the platform app-data directory. */
    public SupervisorModule() {
        this(loadConfig());
    }

    public SupervisorModule(SupervisorConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(SupervisorConfig.class).toInstance(config);
        bind(CommandRunner.class).toInstance(new SystemCommandRunner());
    }

    @Provides
    @Singleton
    TerminationStrategy terminationStrategy(CommandRunner runner, SupervisorConfig config) {
        TerminationStrategy strategy = TerminationStrategies.forCurrentPlatform(runner, config);
        LOG.debug("Using {}", strategy.getClass().getSimpleName());
        return strategy;
    }

    @Provides
    @Singleton
    ProcessEventSink eventSink(EventBusSink eventBusSink) {
        return CompositeSink.of(new LoggingSink(), eventBusSink);
    }

    private static SupervisorConfig loadConfig() {
        Path configPath = StorageUtils.getConfigFile(StorageUtils.APP_NAME);
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        return ConfigLoader.from(configPath).load(SupervisorConfig::new);
    }
}
