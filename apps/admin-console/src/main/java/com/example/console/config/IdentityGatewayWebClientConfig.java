package com.example.console.config;

import com.example.console.config.properties.IdentityGatewayProperties;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.security.oauth2.client.AuthorizedClientServiceReactiveOAuth2AuthorizedClientManager;
import org.springframework.security.oauth2.client.InMemoryReactiveOAuth2AuthorizedClientService;
import org.springframework.security.oauth2.client.ReactiveOAuth2AuthorizedClientManager;
import org.springframework.security.oauth2.client.ReactiveOAuth2AuthorizedClientProviderBuilder;
import org.springframework.security.oauth2.client.registration.ReactiveClientRegistrationRepository;
import org.springframework.security.oauth2.client.web.reactive.function.client.ServerOAuth2AuthorizedClientExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * WebClient for the identity gateway.
 *
 * The console authenticates to the gateway with its own client credentials; the
 * token is fetched on first use, cached and refreshed ahead of expiry.
 */
@Configuration
public class IdentityGatewayWebClientConfig {

    /**
     * OAuth2 client registration id. Must match the registration in application.yml.
     */
    public static final String IDENTITY_GATEWAY_CLIENT_REGISTRATION_ID = "identity-gateway";

    public static final String IDENTITY_GATEWAY_WEBCLIENT = "identityGatewayWebClient";

    @Bean
    public ReactiveOAuth2AuthorizedClientManager identityGatewayAuthorizedClientManager(
            ReactiveClientRegistrationRepository clientRegistrationRepository) {

        var clientProvider = ReactiveOAuth2AuthorizedClientProviderBuilder.builder()
                .clientCredentials(builder -> builder
                        .clockSkew(Duration.ofSeconds(60))
                )
                .build();

        var authorizedClientService = new InMemoryReactiveOAuth2AuthorizedClientService(clientRegistrationRepository);
        var authorizedClientManager = new AuthorizedClientServiceReactiveOAuth2AuthorizedClientManager(
                clientRegistrationRepository,
                authorizedClientService
        );
        authorizedClientManager.setAuthorizedClientProvider(clientProvider);

        return authorizedClientManager;
    }

    /**
     * Pooled client with connect and response timeouts. The response timeout is
     * the same bound {@code IdentityGatewayClient} applies to the whole call.
     */
    @Bean(IDENTITY_GATEWAY_WEBCLIENT)
    public WebClient identityGatewayWebClient(
            WebClient.Builder webClientBuilder,
            ReactiveOAuth2AuthorizedClientManager identityGatewayAuthorizedClientManager,
            IdentityGatewayProperties properties) {

        ConnectionProvider connectionProvider = ConnectionProvider.builder("identity-gateway-pool")
                .maxConnections(properties.maxConnections())
                .pendingAcquireMaxCount(properties.maxConnections() * 4)
                .pendingAcquireTimeout(properties.timeout())
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis())
                .responseTimeout(properties.timeout())
                .keepAlive(true);

        var oauth2Filter = new ServerOAuth2AuthorizedClientExchangeFilterFunction(identityGatewayAuthorizedClientManager);
        oauth2Filter.setDefaultClientRegistrationId(IDENTITY_GATEWAY_CLIENT_REGISTRATION_ID);

        return webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(properties.baseUrl())
                .filter(oauth2Filter)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(properties.maxInMemorySizeKb() * 1024))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
