package com.campaignhub.backend.services;

import com.campaignhub.backend.config.AggregationConfig.AggregationProperties;
import com.campaignhub.backend.config.JacksonConfig;
import com.campaignhub.backend.enums.FailureReason;
import com.campaignhub.backend.enums.Platform;
import com.campaignhub.backend.exceptions.AllSourcesFailedException;
import com.campaignhub.backend.exceptions.PlatformIntegrationException;
import com.campaignhub.backend.integrations.CampaignSourceClient;
import com.campaignhub.backend.integrations.CampaignSourceRegistry;
import com.campaignhub.backend.integrations.GoogleAdsCampaignClient;
import com.campaignhub.backend.integrations.MetaAdsCampaignClient;
import com.campaignhub.backend.models.UnifiedCampaign;
import com.campaignhub.backend.util.StubSourceClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static com.campaignhub.backend.util.CampaignTestData.campaign;
import static org.assertj.core.api.Assertions.*;

class CampaignAggregationServiceTest {

    private ThreadPoolTaskExecutor executor;
    private MeterRegistry meterRegistry;
    private AggregationProperties aggregationProperties;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.initialize();

        meterRegistry = new SimpleMeterRegistry();
        aggregationProperties = new AggregationProperties(
                Duration.ofMillis(300), List.of(Platform.GOOGLE, Platform.META), 4, 10);
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdown();
    }

    @Test
    void getCampaigns_MergesAndRanksAllSources() {
        // Given
        CampaignAggregationService service = serviceWith(
                StubSourceClient.returning(Platform.GOOGLE, List.of(
                        campaign("g1", Platform.GOOGLE, "100"),
                        campaign("g2", Platform.GOOGLE, "300"))),
                StubSourceClient.returning(Platform.META, List.of(
                        campaign("m1", Platform.META, "200"))));

        // When
        List<UnifiedCampaign> campaigns = service.getCampaigns();

        // Then
        assertThat(campaigns).extracting(UnifiedCampaign::getId).containsExactly("g2", "m1", "g1");
    }

    @Test
    void getCampaigns_OneSourceFails_ReturnsOtherSourcesRecords() {
        // Given
        CampaignAggregationService service = serviceWith(
                StubSourceClient.failing(Platform.GOOGLE, FailureReason.UPSTREAM_STATUS),
                StubSourceClient.returning(Platform.META, List.of(
                        campaign("m1", Platform.META, "20"),
                        campaign("m2", Platform.META, "40"),
                        campaign("m3", Platform.META, "30"))));

        // When
        List<UnifiedCampaign> campaigns = service.getCampaigns();

        // Then
        assertThat(campaigns).hasSize(3);
        assertThat(campaigns).allMatch(c -> c.getPlatform() == Platform.META);
    }

    @Test
    void getCampaigns_HangingSourceIsDroppedAtDeadline() {
        // Given
        CampaignAggregationService service = serviceWith(
                StubSourceClient.hanging(Platform.GOOGLE, release),
                StubSourceClient.returning(Platform.META, List.of(campaign("m1", Platform.META, "20"))));

        // When
        List<UnifiedCampaign> campaigns = service.getCampaigns();

        // Then
        assertThat(campaigns).extracting(UnifiedCampaign::getId).containsExactly("m1");
    }

    @Test
    void getCampaigns_SuccessfulButEmptySourceIsNotAFailure() {
        // Given
        CampaignAggregationService service = serviceWith(
                StubSourceClient.failing(Platform.GOOGLE, FailureReason.TRANSPORT),
                StubSourceClient.returning(Platform.META, List.of()));

        // When
        List<UnifiedCampaign> campaigns = service.getCampaigns();

        // Then
        assertThat(campaigns).isEmpty();
    }

    @Test
    void getCampaigns_AllSourcesFail_ThrowsAllSourcesFailed() {
        // Given
        CampaignAggregationService service = serviceWith(
                StubSourceClient.failing(Platform.GOOGLE, FailureReason.TRANSPORT),
                StubSourceClient.throwing(Platform.META, new IllegalStateException("boom")));

        // When / Then
        assertThatThrownBy(service::getCampaigns)
                .isInstanceOf(AllSourcesFailedException.class)
                .satisfies(ex -> {
                    AllSourcesFailedException failure = (AllSourcesFailedException) ex;
                    assertThat(failure.getFailures()).hasSize(2);
                    assertThat(failure.getFailures()).extracting(f -> f.getPlatform())
                            .containsExactly(Platform.GOOGLE, Platform.META);
                    assertThat(failure.getFailures()).extracting(f -> f.getReason())
                            .containsExactly(FailureReason.TRANSPORT, FailureReason.UNEXPECTED);
                });

        assertThat(meterRegistry.get("campaign.aggregation.all_failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void getCampaigns_QueriesSourcesOnEveryCall() {
        // Given
        StubSourceClient google = StubSourceClient.returning(Platform.GOOGLE,
                List.of(campaign("g1", Platform.GOOGLE, "10")));
        StubSourceClient meta = StubSourceClient.returning(Platform.META, List.of());
        CampaignAggregationService service = serviceWith(google, meta);

        // When
        service.getCampaigns();
        service.getCampaigns();

        // Then
        assertThat(google.getCalls()).isEqualTo(2);
        assertThat(meta.getCalls()).isEqualTo(2);
    }

    @Test
    void getCampaigns_ErrorBodiesFromEveryGatewaySource_ThrowsAllSourcesFailed() {
        // Given - the gateway answers 200 with an error object instead of campaigns
        aggregationProperties = new AggregationProperties(
                Duration.ofSeconds(5), List.of(Platform.GOOGLE, Platform.META), 4, 10);
        WebClient gateway = WebClient.builder()
                .baseUrl("http://gateway.test")
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body("{\"error\": {\"message\": \"upstream schema v2\"}, \"campaigns\": []}")
                        .build()))
                .build();
        ObjectMapper objectMapper = new JacksonConfig().objectMapper();
        CampaignAggregationService service = serviceWith(
                new GoogleAdsCampaignClient(gateway, objectMapper),
                new MetaAdsCampaignClient(gateway, objectMapper));

        // When / Then
        assertThatThrownBy(service::getCampaigns)
                .isInstanceOf(AllSourcesFailedException.class)
                .satisfies(ex -> assertThat(((AllSourcesFailedException) ex).getFailures())
                        .extracting(PlatformIntegrationException::getReason)
                        .containsExactly(FailureReason.MALFORMED_PAYLOAD, FailureReason.MALFORMED_PAYLOAD));
    }

    private CampaignAggregationService serviceWith(CampaignSourceClient... clients) {
        CampaignSourceRegistry registry = new CampaignSourceRegistry(List.of(clients), aggregationProperties);
        return new CampaignAggregationService(
                registry,
                new CampaignFanOutCoordinator(executor, meterRegistry),
                new CampaignRankingService(),
                aggregationProperties,
                meterRegistry);
    }
}
