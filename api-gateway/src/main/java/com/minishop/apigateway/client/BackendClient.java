package com.minishop.apigateway.client;

import com.minishop.apigateway.error.UpstreamException;
import com.minishop.apigateway.filter.RequestIdFilter;
import com.minishop.apigateway.route.Backend;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Sends a request to one of the backends and hands back the raw response. Every failure, whether
 * the backend could not be reached, did not answer in time or answered with an error status,
 * comes out as an {@link UpstreamException}.
 */
@Component
public class BackendClient {

  private final WebClient webClient;
  private final Map<Backend, String> baseUrls;
  private final Duration responseTimeout;

  @Autowired
  public BackendClient(
      WebClient.Builder webClientBuilder,
      @Value("${users-service.url}") String usersServiceUrl,
      @Value("${products-service.url}") String productsServiceUrl,
      @Value("${gateway.connect-timeout-ms:2000}") int connectTimeoutMillis,
      @Value("${gateway.response-timeout-ms:5000}") long responseTimeoutMillis) {
    this(
        webClientBuilder
            .clientConnector(
                new ReactorClientHttpConnector(
                    HttpClient.create()
                        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                        .responseTimeout(Duration.ofMillis(responseTimeoutMillis))))
            .build(),
        baseUrls(usersServiceUrl, productsServiceUrl),
        Duration.ofMillis(responseTimeoutMillis));
  }

  public BackendClient(
      WebClient webClient, Map<Backend, String> baseUrls, Duration responseTimeout) {
    this.webClient = webClient;
    this.baseUrls = new EnumMap<>(baseUrls);
    this.responseTimeout = responseTimeout;
  }

  /**
   * Forwards a request. {@code rawQuery} is passed on still encoded; {@code body} and {@code
   * requestId} may be {@code null}.
   */
  public Mono<ResponseEntity<String>> forward(
      Backend backend,
      HttpMethod method,
      String path,
      String rawQuery,
      String body,
      String requestId) {
    return Mono.defer(
            () -> {
              URI uri = targetUri(backend, path, rawQuery);
              WebClient.RequestBodySpec request =
                  webClient.method(method).uri(uri).accept(MediaType.APPLICATION_JSON);
              if (requestId != null) {
                request.header(RequestIdFilter.REQUEST_ID_HEADER, requestId);
              }
              WebClient.RequestHeadersSpec<?> ready =
                  body != null
                      ? request.contentType(MediaType.APPLICATION_JSON).bodyValue(body)
                      : request;
              return ready.retrieve().toEntity(String.class);
            })
        .timeout(responseTimeout)
        .onErrorMap(e -> !(e instanceof UpstreamException), this::toUpstreamException);
  }

  URI targetUri(Backend backend, String path, String rawQuery) {
    return UriComponentsBuilder.fromHttpUrl(baseUrls.get(backend))
        .path(path)
        .query(rawQuery)
        .build(true)
        .toUri();
  }

  private UpstreamException toUpstreamException(Throwable e) {
    if (e instanceof WebClientResponseException) {
      WebClientResponseException responseException = (WebClientResponseException) e;
      return new UpstreamException(
          responseException.getStatusCode().value(), responseException.getMessage(), e);
    }
    if (e instanceof TimeoutException) {
      return new UpstreamException(
          0, "No response within " + responseTimeout.toMillis() + " ms", e);
    }
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return new UpstreamException(0, message, e);
  }

  private static Map<Backend, String> baseUrls(String usersServiceUrl, String productsServiceUrl) {
    Map<Backend, String> urls = new EnumMap<>(Backend.class);
    urls.put(Backend.USERS, usersServiceUrl);
    urls.put(Backend.PRODUCTS, productsServiceUrl);
    return urls;
  }
}
