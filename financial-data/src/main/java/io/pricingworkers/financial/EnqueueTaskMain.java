package io.pricingworkers.financial;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.pricingworkers.broker.BrokerUnavailableException;
import io.pricingworkers.broker.TaskProducer;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.core.InvalidPayloadException;
import io.pricingworkers.core.Json;
import io.pricingworkers.core.ResultRecord;
import io.pricingworkers.core.ResultStatus;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.ConfigurationException;
import io.pricingworkers.runtime.WorkerModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Producer CLI: puts one task on the broker and optionally waits for its result.
 */
@CommandLine.Command(name = "enqueue-task", mixinStandardHelpOptions = true, description = "Submit a task to the pricing workers")
public final class EnqueueTaskMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(EnqueueTaskMain.class);

    @CommandLine.Option(names = {"-t", "--task"}, required = true, description = "Task name, e.g. get_new_pricing_data")
    String task;

    @CommandLine.Option(names = {"-p", "--payload"}, description = "Payload field as key=value (repeatable)")
    Map<String, String> payload = new LinkedHashMap<>();

    @CommandLine.Option(names = "--wait", description = "Wait for the terminal result")
    boolean await;

    @CommandLine.Option(names = "--timeout-seconds", description = "How long --wait waits", defaultValue = "60")
    long timeoutSeconds;

    public static void main(String[] args) {
        int code = new CommandLine(new EnqueueTaskMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        TaskProducer producer;
        TaskName name;
        try {
            name = TaskName.fromWire(task);
            WorkerConfig config = WorkerConfig.fromEnv();
            Injector injector = Guice.createInjector(new WorkerModule(config));
            producer = injector.getInstance(TaskProducer.class);
        } catch (ConfigurationException | InvalidPayloadException | CreationException | ProvisionException e) {
            log.error("cannot start producer: {}", e.getMessage());
            return 1;
        }

        String id;
        try {
            id = producer.submit(name, new LinkedHashMap<>(payload));
        } catch (InvalidPayloadException e) {
            log.error("rejected {}: {}", name, e.getMessage());
            return 2;
        } catch (BrokerUnavailableException e) {
            log.error("broker unavailable: {}", e.getMessage());
            return 1;
        }
        System.out.println(id);
        if (!await) return 0;

        Optional<ResultRecord> result = producer.awaitResult(id, Duration.ofSeconds(timeoutSeconds));
        if (result.isEmpty()) {
            log.warn("no terminal result for {} after {}s", id, timeoutSeconds);
            return 3;
        }
        System.out.println(Json.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(result.get()));
        return result.get().status() == ResultStatus.SUCCESS ? 0 : 4;
    }
}
