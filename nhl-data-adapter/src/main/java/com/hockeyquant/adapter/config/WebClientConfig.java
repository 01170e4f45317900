package com.hockeyquant.adapter.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * One WebClient per upstream host. Every call is bounded by the configured
 * connect and response timeouts so a slow upstream fails instead of hanging a slate.
 */
@Configuration
@EnableConfigurationProperties(DataSourceProperties.class)
public class WebClientConfig {

    private final DataSourceProperties properties;

    public WebClientConfig(DataSourceProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient nhlWebClient() {
        return build(properties.getNhlBaseUrl());
    }

    @Bean
    public WebClient moneyPuckWebClient() {
        return build(properties.getMoneyPuckBaseUrl());
    }

    @Bean
    public WebClient espnWebClient() {
        return build(properties.getEspnBaseUrl());
    }

    private WebClient build(String baseUrl) {
        long timeoutSeconds = properties.getResponseTimeout().toSeconds();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutMillis())
                .responseTimeout(properties.getResponseTimeout())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                );

        // MoneyPuck season summaries run to several MB of CSV
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                .build();

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }
}
