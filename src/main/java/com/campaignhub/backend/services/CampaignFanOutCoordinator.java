package com.campaignhub.backend.services;

import com.campaignhub.backend.enums.FailureReason;
import com.campaignhub.backend.exceptions.PlatformIntegrationException;
import com.campaignhub.backend.integrations.CampaignSourceClient;
import com.campaignhub.backend.integrations.FetchContext;
import com.campaignhub.backend.models.SourceOutcome;
import com.campaignhub.backend.models.UnifiedCampaign;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every source fetch concurrently under one shared deadline and collects one
 * {@link SourceOutcome} per source.
 *
 * Each fetch is its own failure domain: exceptions, rejections and deadline expiry
 * become a failed outcome for that source only. The returned list is in source order
 * and is only produced once every source has completed or timed out.
 */
@Service
@Slf4j
public class CampaignFanOutCoordinator {

    private final AsyncTaskExecutor campaignFetchExecutor;
    private final MeterRegistry meterRegistry;

    public CampaignFanOutCoordinator(@Qualifier("campaignFetchExecutor") AsyncTaskExecutor campaignFetchExecutor,
                                     MeterRegistry meterRegistry) {
        this.campaignFetchExecutor = campaignFetchExecutor;
        this.meterRegistry = meterRegistry;
    }

    public List<SourceOutcome> fetchAll(List<CampaignSourceClient> sources, Duration timeout) {
        FetchContext context = FetchContext.withTimeout(timeout);

        List<Future<SourceOutcome>> futures = new ArrayList<>(sources.size());
        for (CampaignSourceClient source : sources) {
            futures.add(submit(source, context));
        }

        List<SourceOutcome> outcomes = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            SourceOutcome outcome = await(sources.get(i), futures.get(i), context);
            record(outcome);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private Future<SourceOutcome> submit(CampaignSourceClient source, FetchContext context) {
        try {
            return campaignFetchExecutor.submit(() -> fetchOne(source, context));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(SourceOutcome.failure(
                    new PlatformIntegrationException(source.getPlatform(), FailureReason.UNEXPECTED,
                            "Fetch rejected by worker pool", e),
                    Duration.ZERO));
        }
    }

    private SourceOutcome fetchOne(CampaignSourceClient source, FetchContext context) {
        long started = System.nanoTime();
        try {
            List<UnifiedCampaign> campaigns = source.fetchCampaigns(context);
            return SourceOutcome.success(source.getPlatform(), campaigns, since(started));

        } catch (PlatformIntegrationException e) {
            return SourceOutcome.failure(e, since(started));

        } catch (RuntimeException e) {
            return SourceOutcome.failure(
                    new PlatformIntegrationException(source.getPlatform(), FailureReason.UNEXPECTED,
                            "Source client failed: " + e.getMessage(), e),
                    since(started));
        }
    }

    private SourceOutcome await(CampaignSourceClient source, Future<SourceOutcome> future,
                                FetchContext context) {
        try {
            return future.get(context.remaining().toNanos(), TimeUnit.NANOSECONDS);

        } catch (TimeoutException e) {
            // Interrupts the worker so a stuck fetch does not hold a pool thread
            future.cancel(true);
            return SourceOutcome.failure(
                    new PlatformIntegrationException(source.getPlatform(), FailureReason.TIMEOUT,
                            "No result within " + context.getBudget().toMillis() + "ms", e),
                    context.getBudget());

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return SourceOutcome.failure(
                    new PlatformIntegrationException(source.getPlatform(), FailureReason.UNEXPECTED,
                            "Source client failed: " + cause.getMessage(), cause),
                    context.getBudget().minus(context.remaining()));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return SourceOutcome.failure(
                    new PlatformIntegrationException(source.getPlatform(), FailureReason.TIMEOUT,
                            "Interrupted while waiting for source", e),
                    context.getBudget().minus(context.remaining()));
        }
    }

    private void record(SourceOutcome outcome) {
        String platform = outcome.getPlatform().getValue();

        if (outcome.isSuccess()) {
            log.debug("Source {} returned {} campaigns in {}ms",
                    platform, outcome.getCampaigns().size(), outcome.getElapsed().toMillis());
        } else {
            PlatformIntegrationException error = outcome.getError();
            log.warn("Source {} failed after {}ms ({}): {}",
                    platform, outcome.getElapsed().toMillis(), error.getReason(), error.getMessage());
        }

        Counter.builder("campaign.source.fetches")
                .description("Number of source fetches by outcome")
                .tag("platform", platform)
                .tag("outcome", outcome.isSuccess() ? "success" : "failure")
                .tag("reason", outcome.isSuccess() ? "none" : outcome.getError().getReason().name())
                .register(meterRegistry)
                .increment();

        Timer.builder("campaign.source.fetch.duration")
                .description("Source fetch duration")
                .tag("platform", platform)
                .register(meterRegistry)
                .record(outcome.getElapsed());
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
