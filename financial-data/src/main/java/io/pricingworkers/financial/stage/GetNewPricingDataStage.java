package io.pricingworkers.financial.stage;

import com.google.inject.Inject;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.core.TaskPayload;
import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.error.StageException;
import io.pricingworkers.financial.pricing.PriceBar;
import io.pricingworkers.financial.pricing.PricingCsv;
import io.pricingworkers.financial.yahoo.PricingClient;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Pulls daily bars for a ticker from the pricing source and hands them on as CSV to
 * {@code handle_pricing_update_task}. Writes nothing itself.
 */
public class GetNewPricingDataStage extends PricingStage {
    private static final Logger log = LoggerFactory.getLogger(GetNewPricingDataStage.class);
    static final int DEFAULT_LOOKBACK_DAYS = 30;

    private final PricingClient client;
    private final long defaultTickerId;

    @Inject
    public GetNewPricingDataStage(PricingClient client, WorkerConfig config) {
        this(client, config.tickerId());
    }

    public GetNewPricingDataStage(PricingClient client, long defaultTickerId) {
        super(TaskName.GET_NEW_PRICING_DATA);
        this.client = client;
        this.defaultTickerId = defaultTickerId;
    }

    @Override
    protected StageResult run(StageContext ctx) {
        TaskPayload p = ctx.payload();
        String ticker = p.ticker();
        LocalDate end = p.optDate("end").orElse(LocalDate.ofInstant(ctx.now(), ZoneOffset.UTC));
        LocalDate start = p.optDate("start").orElse(end.minusDays(DEFAULT_LOOKBACK_DAYS));
        if (start.isAfter(end)) throw StageException.validation("start " + start + " is after end " + end);
        String interval = p.optString("interval").orElse("1d");

        List<PriceBar> bars;
        try {
            bars = client.fetchDaily(ticker, start, end, interval);
        } catch (IOException e) {
            throw new StageException(ErrorKind.TRANSIENT_INFRA, "PricingFetchFailed",
                    client.source() + " fetch failed for " + ticker, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException(ErrorKind.TRANSIENT_INFRA, "PricingFetchInterrupted", "fetch interrupted for " + ticker, e);
        }
        if (bars.isEmpty()) {
            throw StageException.dataUnavailable("NoPricingData", "no " + interval + " bars for " + ticker + " in " + start + ".." + end)
                    .detail("ticker", ticker);
        }
        log.info("fetched ticker={} bars={} range={}..{} source={}", ticker, bars.size(), start, end, client.source());

        long tickerId = p.longValue("ticker_id", defaultTickerId);
        return StageResult.success()
                .withFollowUp(ctx.followUp(TaskName.HANDLE_PRICING_UPDATE_TASK, payload(
                        "ticker", ticker,
                        "ticker_id", tickerId,
                        "data", PricingCsv.formatBars(bars),
                        "source", client.source())))
                .withSummary("ticker", ticker)
                .withSummary("rows", bars.size())
                .withSummary("start", start.toString())
                .withSummary("end", end.toString());
    }
}
