package com.lphedge.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lphedge.binance.model.BinanceOrderRequest;
import com.lphedge.binance.model.BinanceOrderSide;
import com.lphedge.binance.model.BookTicker;
import com.lphedge.binance.model.FundingRate;
import com.lphedge.hedge.FuturesPositionRecord;
import com.lphedge.http.RequestRateLimiter;
import com.lphedge.http.RetryPolicy;
import com.lphedge.http.StubHttpResponse;
import com.lphedge.http.VenueHttpTransport;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BinanceFuturesClientTest {

  private static final Clock DOC_CLOCK = Clock.fixed(Instant.ofEpochMilli(1_499_827_319_559L), ZoneOffset.UTC);

  private final HttpClient httpClient = mock(HttpClient.class);
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final VenueHttpTransport transport =
      new VenueHttpTransport(httpClient, objectMapper, RequestRateLimiter.noop(), RetryPolicy.disabled());

  private BinanceFuturesClient client(String apiKey, String apiSecret) {
    return new BinanceFuturesClient(URI.create("https://fapi.binance.com"), transport, objectMapper, DOC_CLOCK,
        apiKey, apiSecret, 5_000);
  }

  private HttpRequest lastRequest() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getValue();
  }

  @Test
  void signQueryAppendsRecvWindowTimestampAndSignature() {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", "LTCBTC");
    params.put("side", "BUY");
    params.put("type", "LIMIT");
    params.put("timeInForce", "GTC");
    params.put("quantity", "1");
    params.put("price", "0.1");

    String signed = client("key", BinanceHmacSignerTest.DOC_SECRET).signQuery(params);

    assertThat(signed).isEqualTo(BinanceHmacSignerTest.DOC_QUERY + "&signature=" + BinanceHmacSignerTest.DOC_SIGNATURE);
  }

  @Test
  void getPositionSendsSignedRequestAndMapsFields() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(StubHttpResponse.of(200, """
        [{"symbol":"BNBUSDC","positionSide":"BOTH","positionAmt":"-5.00","entryPrice":"590.0",
          "markPrice":"600.12","unRealizedProfit":"-50.60","liquidationPrice":"0","notional":"-3000.6",
          "marginAsset":"USDC","isolatedMargin":"0","updateTime":1700000000000}]
        """));

    List<FuturesPositionRecord> positions = client("my-key", "my-secret").getPosition("BNBUSDC");

    assertThat(positions).containsExactly(
        new FuturesPositionRecord("BNBUSDC", "-5.00", "600.12", "-50.60", 1_700_000_000_000L));

    HttpRequest request = lastRequest();
    assertThat(request.method()).isEqualTo("GET");
    assertThat(request.uri().getPath()).isEqualTo("/fapi/v3/positionRisk");
    assertThat(request.uri().getRawQuery())
        .startsWith("symbol=BNBUSDC&recvWindow=5000&timestamp=1499827319559&signature=");
    assertThat(request.headers().firstValue("X-MBX-APIKEY")).contains("my-key");
  }

  @Test
  void signedCallsRequireCredentials() {
    assertThatThrownBy(() -> client("", "").getPosition("BNBUSDC")).isInstanceOf(IllegalStateException.class);
    verifyNoInteractions(httpClient);
  }

  @Test
  void bookTickerIsPublic() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(StubHttpResponse.of(200,
        "{\"symbol\":\"BNBUSDC\",\"bidPrice\":\"600.10\",\"bidQty\":\"3\",\"askPrice\":\"600.20\",\"askQty\":\"4\",\"time\":1}"));

    BookTicker ticker = client("", "").bookTicker("BNBUSDC");

    assertThat(ticker.askPrice()).isEqualByComparingTo("600.20");
    assertThat(ticker.bidPrice()).isEqualByComparingTo("600.10");
    HttpRequest request = lastRequest();
    assertThat(request.uri().toString()).isEqualTo("https://fapi.binance.com/fapi/v1/ticker/bookTicker?symbol=BNBUSDC");
    assertThat(request.headers().firstValue("X-MBX-APIKEY")).isEmpty();
  }

  @Test
  void fundingRatesClampLimit() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(StubHttpResponse.of(200,
        "[{\"symbol\":\"BNBUSDC\",\"fundingTime\":1700000000000,\"fundingRate\":\"0.00010000\",\"markPrice\":\"600.0\"}]"));

    List<FundingRate> rates = client("", "").fundingRates("BNBUSDC", 5_000);

    assertThat(rates).hasSize(1);
    assertThat(rates.get(0).fundingRate()).isEqualByComparingTo(new BigDecimal("0.0001"));
    assertThat(lastRequest().uri().getRawQuery()).isEqualTo("symbol=BNBUSDC&limit=1000");
  }

  @Test
  void placeOrderPostsSignedForm() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(StubHttpResponse.of(200,
        "{\"orderId\":42,\"symbol\":\"BNBUSDC\",\"status\":\"NEW\"}"));

    JsonNode ack = client("my-key", "my-secret").placeOrder(
        new BinanceOrderRequest("BNBUSDC", BinanceOrderSide.BUY, "7.0", new BigDecimal("600.10"), null, true));

    assertThat(ack.get("orderId").asLong()).isEqualTo(42L);
    HttpRequest request = lastRequest();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.uri().toString()).isEqualTo("https://fapi.binance.com/fapi/v1/order");
    assertThat(request.headers().firstValue("Content-Type")).contains("application/x-www-form-urlencoded");
    assertThat(request.headers().firstValue("X-MBX-APIKEY")).contains("my-key");
  }
}
