package com.minishop.apigateway.client;

import com.minishop.apigateway.error.UpstreamException;
import com.minishop.apigateway.route.Backend;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class BackendClientTest {

  private static final Map<Backend, String> BASE_URLS =
      Map.of(Backend.USERS, "http://users:3001", Backend.PRODUCTS, "http://products:3002");

  @Test
  void targetUri_shouldJoinBaseUrlPathAndEncodedQuery() {
    BackendClient client = new BackendClient(WebClient.create(), BASE_URLS, Duration.ofSeconds(1));

    assertThat(client.targetUri(Backend.USERS, "/users/3", null).toString())
        .isEqualTo("http://users:3001/users/3");
    assertThat(client.targetUri(Backend.PRODUCTS, "/products", "category=Home%20Office").toString())
        .isEqualTo("http://products:3002/products?category=Home%20Office");
  }

  @Test
  void forward_shouldCarryErrorStatus() {
    WebClient webClient =
        WebClient.builder()
            .exchangeFunction(
                request ->
                    Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()))
            .build();
    BackendClient client = new BackendClient(webClient, BASE_URLS, Duration.ofSeconds(1));

    StepVerifier.create(client.forward(Backend.USERS, HttpMethod.GET, "/users", null, null, null))
        .expectErrorSatisfies(
            e -> {
              assertThat(e).isInstanceOf(UpstreamException.class);
              assertThat(((UpstreamException) e).getStatus()).isEqualTo(503);
              assertThat(((UpstreamException) e).isNotFound()).isFalse();
            })
        .verify();
  }
}
