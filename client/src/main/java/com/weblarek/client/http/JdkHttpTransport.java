package com.weblarek.client.http;

import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.weblarek.client.ClientConfig;

import lombok.extern.slf4j.Slf4j;

/**
 * java.net.http.HttpClient 기반 전송 계층.
 * CookieManager가 브라우저 쿠키 저장소 역할을 한다 (Path=/auth 쿠키는 /auth/** 요청에만 실린다).
 */
@Slf4j
public class JdkHttpTransport implements HttpTransport {

    private static final String BEARER_PREFIX = "Bearer ";

    private final ClientConfig config;
    private final CookieManager cookieManager;
    private final HttpClient httpClient;

    public JdkHttpTransport(ClientConfig config) {
        this.config = config;
        this.cookieManager = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.requestTimeout())
                .cookieHandler(cookieManager)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public CompletableFuture<ApiResponse> send(ApiRequest request, String accessTokenOrNull) {
        HttpRequest httpRequest = toHttpRequest(request, accessTokenOrNull);

        CompletableFuture<ApiResponse> result = new CompletableFuture<>();
        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .whenComplete((response, error) -> {
                    if (error != null) {
                        Throwable cause = (error instanceof CompletionException && error.getCause() != null)
                                ? error.getCause()
                                : error;
                        log.debug("전송 실패: {} {} ({})", request.method(), request.path(), cause.toString());
                        result.completeExceptionally(new TransportException(
                                "Request failed: " + request.method() + " " + request.path(), cause));
                        return;
                    }
                    result.complete(new ApiResponse(response.statusCode(), response.body(), response.headers().map()));
                });
        return result;
    }

    @Override
    public void clearCookies() {
        cookieManager.getCookieStore().removeAll();
    }

    private HttpRequest toHttpRequest(ApiRequest request, String accessTokenOrNull) {
        HttpRequest.BodyPublisher body = (request.body() == null)
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(resolve(request.path()))
                .timeout(config.requestTimeout())
                .header("Accept", "application/json")
                .method(request.method(), body);

        if (request.body() != null) {
            builder.header("Content-Type", "application/json");
        }
        if (accessTokenOrNull != null) {
            builder.header("Authorization", BEARER_PREFIX + accessTokenOrNull);
        }
        request.headers().forEach(builder::header);

        return builder.build();
    }

    private URI resolve(String path) {
        String base = config.baseUri().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }
}
