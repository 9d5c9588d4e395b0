package io.pricingworkers.financial;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.multibindings.Multibinder;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.financial.aggregate.AggregateCoordinator;
import io.pricingworkers.financial.algo.Algorithm;
import io.pricingworkers.financial.algo.AlgorithmRegistry;
import io.pricingworkers.financial.algo.BuyAndHold;
import io.pricingworkers.financial.algo.SmaCross;
import io.pricingworkers.financial.stage.GetNewPricingDataStage;
import io.pricingworkers.financial.stage.HandlePricingUpdateStage;
import io.pricingworkers.financial.stage.PreparePricingDatasetStage;
import io.pricingworkers.financial.stage.PublishFromS3ToRedisStage;
import io.pricingworkers.financial.stage.PublishPricingUpdateStage;
import io.pricingworkers.financial.stage.PublishTickerAggregateStage;
import io.pricingworkers.financial.stage.RunAlgoStage;
import io.pricingworkers.financial.stage.ScreenerStage;
import io.pricingworkers.financial.yahoo.HttpYahooClient;
import io.pricingworkers.financial.yahoo.PricingClient;
import io.pricingworkers.financial.yahoo.YahooPricingClient;
import io.pricingworkers.metrics.Metrics;
import io.pricingworkers.runtime.Stage;
import io.pricingworkers.store.DatasetStore;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Contributes the pricing stages and the algorithm capability. Install next to
 * {@link io.pricingworkers.runtime.WorkerModule}.
 */
public class FinancialStagesModule extends AbstractModule {
    private final PricingClient pricingClient;

    public FinancialStagesModule() { this(null); }

    /** @param pricingClient source for {@code get_new_pricing_data}; null means Yahoo over HTTP */
    public FinancialStagesModule(PricingClient pricingClient) {
        this.pricingClient = pricingClient;
    }

    @Override
    protected void configure() {
        Multibinder<Stage> stages = Multibinder.newSetBinder(binder(), Stage.class);
        stages.addBinding().to(GetNewPricingDataStage.class);
        stages.addBinding().to(HandlePricingUpdateStage.class);
        stages.addBinding().to(PreparePricingDatasetStage.class);
        stages.addBinding().to(PublishFromS3ToRedisStage.class);
        stages.addBinding().to(PublishPricingUpdateStage.class);
        stages.addBinding().to(ScreenerStage.class);
        stages.addBinding().to(PublishTickerAggregateStage.class);
        stages.addBinding().to(RunAlgoStage.class);

        Multibinder<Algorithm> algorithms = Multibinder.newSetBinder(binder(), Algorithm.class);
        algorithms.addBinding().to(BuyAndHold.class);
        algorithms.addBinding().to(SmaCross.class);

        Multibinder.newSetBinder(binder(), AutoCloseable.class).addBinding().to(AggregateCoordinator.class);
    }

    @Provides @Singleton AlgorithmRegistry algorithmRegistry(Set<Algorithm> algorithms) {
        return new AlgorithmRegistry(algorithms);
    }

    @Provides @Singleton PricingClient pricingClient(Metrics metrics) {
        return pricingClient != null ? pricingClient : new YahooPricingClient(new HttpYahooClient(), metrics);
    }

    @Provides @Singleton AggregateCoordinator aggregateCoordinator(DatasetStore store, WorkerConfig config, Clock clock) {
        AtomicInteger n = new AtomicInteger();
        ExecutorService readers = Executors.newFixedThreadPool(Math.max(2, config.workers()), r -> {
            Thread t = new Thread(r, "aggregate-read-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new AggregateCoordinator(store, readers, config.aggregateWait(), clock);
    }
}
