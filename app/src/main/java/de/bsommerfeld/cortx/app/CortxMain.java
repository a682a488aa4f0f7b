package de.bsommerfeld.cortx.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.cortx.core.config.SupervisorConfig;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.event.ApplicationEventBus;
import de.bsommerfeld.cortx.core.util.Pauses;
import de.bsommerfeld.cortx.supervisor.LaunchOutcome;
import de.bsommerfeld.cortx.supervisor.LaunchSpec;
import de.bsommerfeld.cortx.supervisor.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs shell commands as one supervised group and exits with 0 if all of
 * them started and finished successfully, 1 otherwise. Usage errors exit with
 * 2.
 */
public final class CortxMain {

    private static final Logger LOG = LoggerFactory.getLogger(CortxMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private CortxMain() {
    }

    public static void main(String[] args) {
        CortxOptions options;
        try {
            options = CortxOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CortxOptions.USAGE);
            System.exit(EXIT_USAGE);
            return;
        }

        Injector injector = Guice.createInjector(new SupervisorModule());
        ProcessSupervisor supervisor = injector.getInstance(ProcessSupervisor.class);

        // Kill every child when the JVM goes down, including on Ctrl+C
        Runtime.getRuntime().addShutdownHook(new Thread(supervisor::shutdown, "cortx-shutdown"));

        System.exit(run(options, injector));
    }

    static int run(CortxOptions options, Injector injector) {
        ProcessSupervisor supervisor = injector.getInstance(ProcessSupervisor.class);
        ApplicationEventBus eventBus = injector.getInstance(ApplicationEventBus.class);
        SupervisorConfig config = injector.getInstance(SupervisorConfig.class);

        ExitTally tally = new ExitTally();
        eventBus.register(tally);
        try {
            List<LaunchSpec> specs = new ArrayList<>();
            for (int i = 0; i < options.commands().size(); i++) {
                specs.add(LaunchSpec.shell(ProcessCategory.GLOBAL_SCRIPT, "step-" + (i + 1),
                        options.workingDirectory(), options.commands().get(i)));
            }

            List<LaunchOutcome> outcomes = supervisor.runGroup(specs, options.mode(), options.stopOnFailure());
            List<String> launched = outcomes.stream()
                    .filter(LaunchOutcome::isSuccess)
                    .map(LaunchOutcome::id)
                    .collect(Collectors.toList());

            awaitExits(supervisor, tally, launched, config);

            boolean allLaunched = outcomes.size() == specs.size() && launched.size() == specs.size();
            boolean ok = allLaunched && tally.allSucceeded(launched);
            LOG.info("{} of {} commands launched, {}", launched.size(), specs.size(),
                    ok ? "all succeeded" : "some failed");
            return ok ? EXIT_OK : EXIT_FAILED;
        } finally {
            eventBus.unregister(tally);
            supervisor.shutdown();
        }
    }

    /**
     * Waits until every launched command reported its exit. The registry entry
     * disappears shortly before the exit event is posted, so once nothing runs
     * anymore the wait continues for at most the output drain timeout.
     */
    private static void awaitExits(ProcessSupervisor supervisor, ExitTally tally, List<String> ids,
            SupervisorConfig config) {
        long poll = Math.max(1, config.getPollIntervalMillis());
        long idleBudget = config.getOutputDrainTimeoutMillis();
        while (!tally.hasAll(ids)) {
            if (!supervisor.hasRunningProcesses()) {
                if (idleBudget <= 0)
                    return;
                idleBudget -= poll;
            }
            if (!Pauses.sleep(poll))
                return;
        }
    }
}
