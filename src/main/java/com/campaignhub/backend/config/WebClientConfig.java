package com.campaignhub.backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(WebClientConfig.GatewayProperties.class)
public class WebClientConfig {

    public static final String SERVICE_AUTH_HEADER = "X-Service-Auth";

    /**
     * Shared client for every source adapter. Reactor Netty pools connections and is
     * safe for concurrent use.
     */
    @Bean
    public WebClient gatewayWebClient(GatewayProperties gatewayProperties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, gatewayProperties.connectTimeout())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(gatewayProperties.readTimeout(), TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(gatewayProperties.writeTimeout(), TimeUnit.MILLISECONDS)));

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(gatewayProperties.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(gatewayProperties.maxInMemorySize()));

        if (!gatewayProperties.serviceToken().isBlank()) {
            builder.defaultHeader(SERVICE_AUTH_HEADER, gatewayProperties.serviceToken());
        }

        return builder.build();
    }

    @ConfigurationProperties(prefix = "gateway")
    public record GatewayProperties(
            @DefaultValue("http://localhost:8000") String baseUrl,
            @DefaultValue("") String serviceToken,
            @DefaultValue("2000") int connectTimeout,
            @DefaultValue("10000") int readTimeout,
            @DefaultValue("10000") int writeTimeout,
            @DefaultValue("4194304") int maxInMemorySize
    ) {
    }
}
