package io.pricingworkers.runtime;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.multibindings.Multibinder;
import io.pricingworkers.broker.Broker;
import io.pricingworkers.broker.BrokerUnavailableException;
import io.pricingworkers.broker.ChannelFactory;
import io.pricingworkers.broker.ResultBackend;
import io.pricingworkers.broker.TaskProducer;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.error.DeadLetterSink;
import io.pricingworkers.error.FileDeadLetterSink;
import io.pricingworkers.metrics.Metrics;
import io.pricingworkers.retry.ExponentialBackoffRetryPolicy;
import io.pricingworkers.retry.RetryPolicy;
import io.pricingworkers.store.DatasetCodec;
import io.pricingworkers.store.DatasetStore;
import io.pricingworkers.store.KeyValueCache;
import io.pricingworkers.store.ObjectStore;
import io.pricingworkers.store.ObjectStores;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Runtime wiring. Stages are contributed by other modules through {@code Multibinder<Stage>}; resources that must be
 * released when the worker pool stops go into {@code Multibinder<AutoCloseable>}.
 */
public class WorkerModule extends AbstractModule {
    private final WorkerConfig config;
    private final Clock clock;

    public WorkerModule(WorkerConfig config) { this(config, Clock.systemUTC()); }

    public WorkerModule(WorkerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    protected void configure() {
        bind(WorkerConfig.class).toInstance(config);
        bind(Clock.class).toInstance(clock);
        Multibinder.newSetBinder(binder(), Stage.class);
        Multibinder.newSetBinder(binder(), AutoCloseable.class);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton ChannelFactory channelFactory() {
        return new ChannelFactory(clock, config.visibilityTimeout(), Duration.ofMillis(config.pollMillis()));
    }

    @Provides @Singleton Broker broker(ChannelFactory channels) throws BrokerUnavailableException {
        return channels.broker(config.broker());
    }

    @Provides @Singleton ResultBackend backend(ChannelFactory channels) throws BrokerUnavailableException {
        return channels.backend(config.backend());
    }

    @Provides @Singleton KeyValueCache cache(ChannelFactory channels) { return channels.cache(config.cache()); }

    @Provides @Singleton ObjectStore objectStore() { return ObjectStores.open(config.objectStoreEndpoint()); }

    @Provides @Singleton DatasetStore datasetStore(ObjectStore objects, KeyValueCache cache, Metrics metrics) {
        return new DatasetStore(objects, cache, new DatasetCodec(), config.cacheTtl(), config.enabledUpload(), config.enabledPublish(), metrics);
    }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(config.maxRetries(), config.retryBaseMillis(), config.retryMaxMillis());
    }

    @Provides @Singleton DeadLetterSink deadLetters() throws IOException { return new FileDeadLetterSink(config.deadLetterFile()); }

    @Provides @Singleton StageRegistry stageRegistry(Set<Stage> stages) { return new StageRegistry(stages); }

    @Provides @Singleton TaskProducer producer(Broker broker, ResultBackend backend, RetryPolicy retry) {
        return new TaskProducer(broker, backend, retry, clock);
    }

    @Provides @Singleton WorkerPool workerPool(Broker broker, ResultBackend backend, StageRegistry stages, RetryPolicy retry,
                                               DeadLetterSink deadLetters, Set<AutoCloseable> resources, Metrics metrics) {
        List<Worker> workers = new ArrayList<>();
        for (int i = 0; i < config.workers(); i++) {
            workers.add(new Worker("worker-" + i, broker, backend, stages, config.capabilities(), retry, deadLetters,
                    metrics, clock, Duration.ofMillis(config.pollMillis())));
        }
        return new WorkerPool(broker, workers, resources, metrics);
    }
}
