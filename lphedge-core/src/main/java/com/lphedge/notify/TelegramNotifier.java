package com.lphedge.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lphedge.hedge.port.Notifier;
import com.lphedge.http.HttpRequestFactory;
import com.lphedge.http.VenueHttpTransport;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pushes text to one Telegram chat through the Bot API {@code sendMessage} method.
 */
public final class TelegramNotifier implements Notifier {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

  private final HttpRequestFactory requestFactory;
  private final VenueHttpTransport transport;
  private final ObjectMapper objectMapper;
  private final String botToken;
  private final String chatId;

  public TelegramNotifier(URI apiBaseUri, VenueHttpTransport transport, ObjectMapper objectMapper, String botToken, String chatId) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(apiBaseUri, "apiBaseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    if (botToken == null || botToken.isBlank()) {
      throw new IllegalArgumentException("Telegram bot token must be set");
    }
    if (chatId == null || chatId.isBlank()) {
      throw new IllegalArgumentException("Telegram chat id must be set");
    }
    this.botToken = botToken.trim();
    this.chatId = chatId.trim();
  }

  @Override
  public void push(String text) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("chat_id", chatId);
    payload.put("text", text == null ? "" : text);

    HttpRequest request = requestFactory.request("/bot" + botToken + "/sendMessage", Map.of())
        .POST(HttpRequest.BodyPublishers.ofString(writeJson(payload)))
        .timeout(HTTP_TIMEOUT)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .build();
    transport.sendString(request, false);
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to encode Telegram payload", e);
    }
  }
}
