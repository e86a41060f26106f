package com.sessionguard.backend.auth.external.provider;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 제공자 HTTP 호출 공통부 (JDK HttpClient + Jackson)
 *
 * - 요청마다 readTimeout을 건다. 연결 타임아웃은 HttpClient 빌더에서 건다.
 * - 2xx: JSON 파싱 결과
 * - 4xx / JSON 아님: PROVIDER_EXCHANGE_FAILED
 * - 5xx / IO / 타임아웃 / 인터럽트: ExternalProviderUnavailableException
 */
@Slf4j
@RequiredArgsConstructor
public class ProviderHttpClient {

    private static final String USER_AGENT = "sessionguard";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public Result<JsonNode> postForm(String provider, String uri, Map<String, String> form) {
        String body = form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));

        HttpRequest request = baseRequest(uri)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return execute(provider, request);
    }

    public Result<JsonNode> getJson(String provider, String uri, String bearerToken) {
        HttpRequest request = baseRequest(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                .GET()
                .build();
        return execute(provider, request);
    }

    private HttpRequest.Builder baseRequest(String uri) {
        return HttpRequest.newBuilder()
                .uri(URI.create(uri))
                .timeout(requestTimeout)
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .header(HttpHeaders.USER_AGENT, USER_AGENT);
    }

    private Result<JsonNode> execute(String provider, HttpRequest request) {
        HttpResponse<String> response = send(provider, request);
        int status = response.statusCode();

        if (status >= 500) {
            throw new ExternalProviderUnavailableException(provider,
                    String.format("%s responded HTTP %d (%s)", provider, status, request.uri().getPath()));
        }
        if (status < 200 || status >= 300) {
            log.warn("외부 제공자 요청 거절: provider={}, path={}, status={}", provider, request.uri().getPath(), status);
            return Result.failure(ErrorCode.PROVIDER_EXCHANGE_FAILED);
        }

        try {
            return Result.success(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            log.warn("외부 제공자 응답 파싱 실패: provider={}, path={}", provider, request.uri().getPath());
            return Result.failure(ErrorCode.PROVIDER_EXCHANGE_FAILED);
        }
    }

    private HttpResponse<String> send(String provider, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalProviderUnavailableException(provider, provider + " request interrupted", e);
        } catch (IOException e) {
            // HttpTimeoutException 포함
            throw new ExternalProviderUnavailableException(provider,
                    String.format("%s request failed: %s", provider, e.getMessage()), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
