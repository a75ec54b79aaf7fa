package com.lphedge.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lphedge.binance.model.BinanceOrderRequest;
import com.lphedge.binance.model.BinancePosition;
import com.lphedge.binance.model.BookTicker;
import com.lphedge.binance.model.FundingRate;
import com.lphedge.hedge.FuturesPositionRecord;
import com.lphedge.hedge.port.FuturesPositionSource;
import com.lphedge.http.HttpRequestFactory;
import com.lphedge.http.VenueHttpTransport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * REST client for Binance USD-M perpetual futures ({@code fapi}).
 */
@Slf4j
public final class BinanceFuturesClient implements FuturesPositionSource {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);
  private static final String API_KEY_HEADER = "X-MBX-APIKEY";

  private final HttpRequestFactory requestFactory;
  private final VenueHttpTransport transport;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String apiKey;
  private final String apiSecret;
  private final long recvWindowMillis;

  public BinanceFuturesClient(
      URI baseUri,
      VenueHttpTransport transport,
      ObjectMapper objectMapper,
      Clock clock,
      String apiKey,
      String apiSecret,
      long recvWindowMillis
  ) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.apiKey = apiKey == null ? "" : apiKey;
    this.apiSecret = apiSecret == null ? "" : apiSecret;
    this.recvWindowMillis = recvWindowMillis;
  }

  @Override
  public List<FuturesPositionRecord> getPosition(String symbol) {
    return positionRisk(symbol).stream()
        .map(p -> new FuturesPositionRecord(
            p.symbol(),
            p.positionAmt(),
            p.markPrice(),
            p.unrealizedProfit(),
            p.updateTime() == null ? 0L : p.updateTime()
        ))
        .toList();
  }

  public List<BinancePosition> positionRisk(String symbol) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", symbol);
    String body = signedGet(BinanceFuturesPaths.POSITION_RISK, params);
    BinancePosition[] positions = decode(body, BinancePosition[].class, BinanceFuturesPaths.POSITION_RISK);
    return positions == null ? List.of() : Arrays.asList(positions);
  }

  public BookTicker bookTicker(String symbol) {
    HttpRequest request = requestFactory.request(BinanceFuturesPaths.BOOK_TICKER, Map.of("symbol", symbol))
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .build();
    return transport.sendJson(request, BookTicker.class);
  }

  public List<FundingRate> fundingRates(String symbol, int limit) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("symbol", symbol);
    query.put("limit", Integer.toString(Math.max(1, Math.min(1000, limit))));
    HttpRequest request = requestFactory.request(BinanceFuturesPaths.FUNDING_RATE, query)
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .build();
    FundingRate[] rates = transport.sendJson(request, FundingRate[].class);
    return rates == null ? List.of() : Arrays.asList(rates);
  }

  public JsonNode placeOrder(BinanceOrderRequest order) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", order.symbol());
    params.put("side", order.side().name());
    params.put("type", "LIMIT");
    params.put("timeInForce", order.timeInForce());
    params.put("quantity", order.quantity());
    params.put("price", order.price().toPlainString());
    if (order.reduceOnly()) {
      params.put("reduceOnly", "true");
    }
    String body = signedForm(BinanceFuturesPaths.ORDER, params);
    return decode(body, JsonNode.class, BinanceFuturesPaths.ORDER);
  }

  String signQuery(Map<String, String> params) {
    Map<String, String> signed = new LinkedHashMap<>(params);
    signed.putIfAbsent("recvWindow", Long.toString(recvWindowMillis));
    signed.putIfAbsent("timestamp", Long.toString(clock.millis()));
    String query = HttpRequestFactory.encodeQuery(signed);
    return query + "&signature=" + BinanceHmacSigner.sign(apiSecret, query);
  }

  private String signedGet(String path, Map<String, String> params) {
    requireCredentials();
    HttpRequest request = requestFactory.requestWithRawQuery(path, signQuery(params))
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header(API_KEY_HEADER, apiKey)
        .header("Accept", "application/json")
        .build();
    return transport.sendString(request, true);
  }

  private String signedForm(String path, Map<String, String> params) {
    requireCredentials();
    HttpRequest request = requestFactory.request(path, Map.of())
        .POST(HttpRequest.BodyPublishers.ofString(signQuery(params)))
        .timeout(HTTP_TIMEOUT)
        .header(API_KEY_HEADER, apiKey)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .build();
    log.debug("binance {} {}", request.method(), path);
    return transport.sendString(request, false);
  }

  private void requireCredentials() {
    if (apiKey.isBlank() || apiSecret.isBlank()) {
      throw new IllegalStateException("Binance API credentials are not configured (lph.binance.api-key / api-secret)");
    }
  }

  private <T> T decode(String body, Class<T> type, String path) {
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to decode Binance response from " + path, e);
    }
  }
}
