package com.lphedge.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VenueHttpTransportTest {

  private final HttpClient httpClient = mock(HttpClient.class);
  private final VenueHttpTransport transport = new VenueHttpTransport(
      httpClient, new ObjectMapper(), RequestRateLimiter.noop(), new RetryPolicy(true, 3, 0, 0));

  @Test
  void retriesIdempotentRequestOnServerError() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(StubHttpResponse.of(503, "busy"))
        .thenReturn(StubHttpResponse.of(200, "{\"ok\":true}"));

    HttpRequest request = HttpRequest.newBuilder(URI.create("https://fapi.binance.com/fapi/v1/ping")).GET().build();
    JsonNode body = transport.sendJson(request, JsonNode.class);

    assertThat(body.get("ok").asBoolean()).isTrue();
    verify(httpClient, times(2)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
  }

  @Test
  void neverRetriesNonIdempotentRequest() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(StubHttpResponse.of(503, "busy"));

    HttpRequest request = HttpRequest.newBuilder(URI.create("https://fapi.binance.com/fapi/v1/order"))
        .POST(HttpRequest.BodyPublishers.ofString("symbol=BNBUSDC"))
        .build();

    assertThatThrownBy(() -> transport.sendString(request, false))
        .isInstanceOfSatisfying(VenueHttpException.class, e -> {
          assertThat(e.statusCode()).isEqualTo(503);
          assertThat(e.method()).isEqualTo("POST");
          assertThat(e.responseSnippet()).isEqualTo("busy");
        });
    verify(httpClient, times(1)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
  }

  @Test
  void clientErrorsAreNotRetried() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(StubHttpResponse.of(400, "{\"code\":-1102}"));

    HttpRequest request = HttpRequest.newBuilder(URI.create("https://fapi.binance.com/fapi/v3/positionRisk")).GET().build();

    assertThatThrownBy(() -> transport.sendString(request, true)).isInstanceOf(VenueHttpException.class);
    verify(httpClient, times(1)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
  }
}
