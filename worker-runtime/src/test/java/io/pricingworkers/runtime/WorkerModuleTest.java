package io.pricingworkers.runtime;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.multibindings.Multibinder;
import io.pricingworkers.broker.Broker;
import io.pricingworkers.broker.TaskProducer;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.core.InvalidPayloadException;
import io.pricingworkers.core.ResultRecord;
import io.pricingworkers.core.ResultStatus;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerModuleTest {

    public static class EchoStage implements Stage {
        private final DatasetStore store;

        @Inject
        public EchoStage(DatasetStore store) { this.store = store; }

        @Override public TaskName taskName() { return TaskName.PUBLISH_FROM_S3_TO_REDIS; }

        @Override
        public StageResult execute(StageContext ctx) {
            String ticker = ctx.payload().ticker();
            return StageResult.success(store.publish(DatasetKey.pricingLatest(ticker), Map.of("ticker", ticker)).ref());
        }
    }

    @Test
    void wires_producer_broker_pool_and_store(@TempDir Path dir) throws Exception {
        Properties props = new Properties();
        props.setProperty("pricing.objectstore.endpoint", "file:" + dir.resolve("store"));
        props.setProperty("pricing.dead.letter.file", dir.resolve("dead.jsonl").toString());
        props.setProperty("pricing.workers", "2");
        props.setProperty("pricing.poll.millis", "20");
        props.setProperty("pricing.broker.address", "memory://wiring:1/3");
        props.setProperty("pricing.backend.address", "memory://wiring:1/4");
        WorkerConfig config = WorkerConfig.from(props, Map.of());

        Injector injector = Guice.createInjector(new WorkerModule(config), new AbstractModule() {
            @Override
            protected void configure() {
                Multibinder.newSetBinder(binder(), Stage.class).addBinding().to(EchoStage.class);
            }
        });
        WorkerPool pool = injector.getInstance(WorkerPool.class);
        TaskProducer producer = injector.getInstance(TaskProducer.class);
        assertSame(injector.getInstance(Broker.class), injector.getInstance(Broker.class));

        pool.start();
        try {
            String id = producer.submit(TaskName.PUBLISH_FROM_S3_TO_REDIS, Map.of("ticker", "spy"));
            ResultRecord r = producer.awaitResult(id, Duration.ofSeconds(10)).orElseThrow();
            assertEquals(ResultStatus.SUCCESS, r.status());
            assertEquals("SPY_latest", r.resultRef().key());
            assertTrue(dir.resolve("store").resolve("pricing").resolve("SPY_latest").toFile().isFile());

            assertThrows(InvalidPayloadException.class, () -> producer.submit(TaskName.TASK_RUN_ALGO, Map.of("ticker", "SPY")));
        } finally {
            pool.stop(Duration.ofSeconds(5));
        }
    }
}
