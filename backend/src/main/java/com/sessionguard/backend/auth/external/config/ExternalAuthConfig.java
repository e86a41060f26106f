package com.sessionguard.backend.auth.external.config;

import java.net.http.HttpClient;
import java.time.Duration;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionguard.backend.auth.config.ExternalAuthProperties;
import com.sessionguard.backend.auth.external.provider.ExternalAuthProvider;
import com.sessionguard.backend.auth.external.provider.ExternalProviderRegistry;
import com.sessionguard.backend.auth.external.provider.GitHubAuthProvider;
import com.sessionguard.backend.auth.external.provider.GoogleAuthProvider;
import com.sessionguard.backend.auth.external.provider.ProviderHttpClient;

/**
 * 외부 로그인 제공자 빈 구성
 *
 * - 제공자별 enabled=true 일 때만 빈을 만든다.
 * - 레지스트리는 만들어진 제공자 빈만 모은다. (하나도 없으면 빈 레지스트리)
 */
@Configuration
public class ExternalAuthConfig {

    @Bean
    public ProviderHttpClient providerHttpClient(ExternalAuthProperties props, ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.connectTimeoutMillis()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        return new ProviderHttpClient(httpClient, objectMapper, Duration.ofMillis(props.readTimeoutMillis()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.auth.external.google", name = "enabled", havingValue = "true")
    public GoogleAuthProvider googleAuthProvider(ExternalAuthProperties props, ProviderHttpClient http) {
        return new GoogleAuthProvider(props.google(), http);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.auth.external.github", name = "enabled", havingValue = "true")
    public GitHubAuthProvider gitHubAuthProvider(ExternalAuthProperties props, ProviderHttpClient http) {
        return new GitHubAuthProvider(props.github(), http);
    }

    @Bean
    public ExternalProviderRegistry externalProviderRegistry(ObjectProvider<ExternalAuthProvider> providers) {
        return new ExternalProviderRegistry(providers.orderedStream().toList());
    }
}
