package com.lphedge.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lphedge.http.RequestRateLimiter;
import com.lphedge.http.RetryPolicy;
import com.lphedge.http.StubHttpResponse;
import com.lphedge.http.VenueHttpException;
import com.lphedge.http.VenueHttpTransport;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramNotifierTest {

  private final HttpClient httpClient = mock(HttpClient.class);
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final VenueHttpTransport transport =
      new VenueHttpTransport(httpClient, objectMapper, RequestRateLimiter.noop(), RetryPolicy.disabled());

  private TelegramNotifier notifier() {
    return new TelegramNotifier(URI.create("https://api.telegram.org"), transport, objectMapper, "123:abc", "-100200");
  }

  @Test
  void postsToSendMessage() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(StubHttpResponse.of(200, "{\"ok\":true}"));

    notifier().push("[BNB] status");

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    HttpRequest request = captor.getValue();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.uri().toString()).isEqualTo("https://api.telegram.org/bot123:abc/sendMessage");
    assertThat(request.headers().firstValue("Content-Type")).contains("application/json");
    assertThat(request.bodyPublisher()).isPresent();
  }

  @Test
  void rejectedMessageSurfacesAsVenueError() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(StubHttpResponse.of(400, "{\"ok\":false,\"description\":\"chat not found\"}"));

    assertThatThrownBy(() -> notifier().push("hello"))
        .isInstanceOfSatisfying(VenueHttpException.class, e -> {
          assertThat(e.statusCode()).isEqualTo(400);
          assertThat(e.getMessage()).doesNotContain("123:abc");
        });
  }

  @Test
  void requiresTokenAndChat() {
    assertThatThrownBy(() -> new TelegramNotifier(URI.create("https://api.telegram.org"), transport, objectMapper, "", "1"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TelegramNotifier(URI.create("https://api.telegram.org"), transport, objectMapper, "t", " "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
