package com.lphedge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lphedge.binance.BinanceFuturesClient;
import com.lphedge.binance.BinanceHedgeTradingService;
import com.lphedge.hedge.LphStrategy;
import com.lphedge.hedge.StrategyConfig;
import com.lphedge.hedge.format.SnapshotMessageFormatter;
import com.lphedge.hedge.format.SnapshotMessageTemplate;
import com.lphedge.hedge.port.Notifier;
import com.lphedge.http.RequestRateLimiter;
import com.lphedge.http.RetryPolicy;
import com.lphedge.http.TokenBucketRateLimiter;
import com.lphedge.http.VenueHttpTransport;
import com.lphedge.notify.LoggingNotifier;
import com.lphedge.notify.TelegramNotifier;
import com.lphedge.uniswap.EthCallClient;
import com.lphedge.uniswap.UniswapV3PositionReader;
import com.lphedge.uniswap.Web3jEthCallClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration(proxyBeanMethods = false)
public class HedgeClientsConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .version(HttpClient.Version.HTTP_1_1)
        .build();
  }

  @Bean
  public VenueHttpTransport venueHttpTransport(
      HedgeProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    HedgeProperties.Rest rest = properties.binance().rest();
    RequestRateLimiter rateLimiter = buildRateLimiter(rest.rateLimit(), clock);
    RetryPolicy retry = buildRetryPolicy(rest.retry());
    return new VenueHttpTransport(httpClient, objectMapper, rateLimiter, retry);
  }

  @Bean
  public BinanceFuturesClient binanceFuturesClient(
      HedgeProperties properties,
      VenueHttpTransport transport,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    HedgeProperties.Binance binance = properties.binance();
    if (!binance.hasCredentials()) {
      log.warn("Binance API credentials missing (lph.binance.api-key / api-secret); signed calls will fail");
    }
    return new BinanceFuturesClient(
        URI.create(binance.restUrl()),
        transport,
        objectMapper,
        clock,
        binance.apiKey(),
        binance.apiSecret(),
        binance.recvWindowMillis()
    );
  }

  @Bean
  public BinanceHedgeTradingService binanceHedgeTradingService(
      HedgeProperties properties,
      BinanceFuturesClient client,
      ObjectMapper objectMapper
  ) {
    return new BinanceHedgeTradingService(properties, client, objectMapper);
  }

  @Bean(destroyMethod = "shutdown")
  public Web3j web3j(HedgeProperties properties) {
    return Web3j.build(new HttpService(properties.chain().rpcUrl()));
  }

  @Bean
  public EthCallClient ethCallClient(Web3j web3j) {
    return new Web3jEthCallClient(web3j);
  }

  @Bean
  public UniswapV3PositionReader uniswapV3PositionReader(HedgeProperties properties, EthCallClient ethCallClient) {
    return new UniswapV3PositionReader(ethCallClient, properties.strategy().positionManagerAddress());
  }

  @Bean
  public Notifier notifier(HedgeProperties properties, VenueHttpTransport transport, ObjectMapper objectMapper) {
    HedgeProperties.Telegram telegram = properties.telegram();
    if (!telegram.enabled()) {
      log.info("Telegram notifications disabled; status messages go to the log");
      return new LoggingNotifier();
    }
    return new TelegramNotifier(
        URI.create(telegram.apiUrl()),
        transport,
        objectMapper,
        telegram.botToken(),
        telegram.chatId()
    );
  }

  @Bean
  public SnapshotMessageFormatter snapshotMessageFormatter(HedgeProperties properties) {
    return new SnapshotMessageFormatter(SnapshotMessageTemplate.ofNullable(properties.message().template()));
  }

  @Bean
  @ConditionalOnProperty(prefix = "lph.strategy", name = "enabled", havingValue = "true", matchIfMissing = true)
  public StrategyConfig strategyConfig(HedgeProperties properties) {
    HedgeProperties.Strategy s = properties.strategy();
    return StrategyConfig.of(
        s.ownerAddress(),
        s.positionManagerAddress(),
        s.baseTokenAddress(),
        s.usdtTokenAddress(),
        s.symbol(),
        s.ratioThreshold(),
        s.deltaThreshold()
    );
  }

  @Bean
  @ConditionalOnProperty(prefix = "lph.strategy", name = "enabled", havingValue = "true", matchIfMissing = true)
  public LphStrategy lphStrategy(
      HedgeProperties properties,
      StrategyConfig strategyConfig,
      UniswapV3PositionReader positionReader,
      BinanceFuturesClient futuresClient,
      BinanceHedgeTradingService tradingService,
      Notifier notifier,
      SnapshotMessageFormatter formatter
  ) {
    return new LphStrategy(
        strategyConfig,
        properties.strategy().label(),
        positionReader,
        futuresClient,
        tradingService,
        notifier,
        formatter
    );
  }

  private static RequestRateLimiter buildRateLimiter(HedgeProperties.RateLimit cfg, Clock clock) {
    if (cfg == null || !cfg.enabled()) {
      return RequestRateLimiter.noop();
    }
    if (cfg.requestsPerSecond() <= 0 || cfg.burst() <= 0) {
      return RequestRateLimiter.noop();
    }
    return new TokenBucketRateLimiter(cfg.requestsPerSecond(), cfg.burst(), clock);
  }

  private static RetryPolicy buildRetryPolicy(HedgeProperties.Retry cfg) {
    if (cfg == null) {
      return RetryPolicy.disabled();
    }
    return new RetryPolicy(
        cfg.enabled(),
        Math.max(1, cfg.maxAttempts()),
        Math.max(0, cfg.initialBackoffMillis()),
        Math.max(0, cfg.maxBackoffMillis())
    );
  }
}
