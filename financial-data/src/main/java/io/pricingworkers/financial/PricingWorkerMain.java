package io.pricingworkers.financial;

import ch.qos.logback.classic.Level;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.core.InvalidPayloadException;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.ConfigurationException;
import io.pricingworkers.metrics.Metrics;
import io.pricingworkers.runtime.WorkerModule;
import io.pricingworkers.runtime.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Starts a worker pool against the configured broker and runs until the JVM is asked to stop.
 */
@CommandLine.Command(name = "pricing-worker", mixinStandardHelpOptions = true, description = "Run pricing pipeline workers")
public final class PricingWorkerMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(PricingWorkerMain.class);

    @CommandLine.Option(names = {"-c", "--capability"}, split = ",", description = "Task names this pool executes (default: all)")
    List<String> capabilities = new ArrayList<>();

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Worker threads (default: from config)")
    Integer workers;

    @CommandLine.Option(names = {"-g", "--grace-seconds"}, description = "Shutdown grace period", defaultValue = "30")
    int graceSeconds;

    public static void main(String[] args) {
        int code = new CommandLine(new PricingWorkerMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        WorkerConfig config;
        try {
            config = WorkerConfig.fromEnv();
            if (workers != null) config = config.withWorkers(workers);
            if (!capabilities.isEmpty()) config = config.withCapabilities(TaskName.parseSet(String.join(",", capabilities)));
            config.validate();
        } catch (ConfigurationException | InvalidPayloadException e) {
            log.error("invalid configuration: {}", e.getMessage());
            return 1;
        }
        applyLogLevel(config.logLevel());
        log.info("starting with {}", config);

        Injector injector;
        WorkerPool pool;
        try {
            injector = Guice.createInjector(new WorkerModule(config), new FinancialStagesModule());
            pool = injector.getInstance(WorkerPool.class);
        } catch (CreationException | ProvisionException e) {
            log.error("startup failed", e);
            return 1;
        }
        Metrics metrics = injector.getInstance(Metrics.class);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("shutdown requested, draining in-flight tasks");
            pool.stop(Duration.ofSeconds(graceSeconds));
            log.info("metrics {}", metrics.snapshot());
            stopped.countDown();
        }, "pricing-worker-shutdown"));

        pool.start();
        stopped.await();
        return 0;
    }

    static void applyLogLevel(String level) {
        if (level == null || level.isBlank()) return;
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(level, Level.INFO));
        }
    }
}
