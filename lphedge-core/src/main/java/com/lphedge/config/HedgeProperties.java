package com.lphedge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "lph")
public record HedgeProperties(
    TradingMode mode,
    @Valid Strategy strategy,
    @Valid Binance binance,
    @Valid Chain chain,
    @Valid Telegram telegram,
    @Valid Message message,
    @Valid Risk risk
) {

  public HedgeProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (strategy == null) {
      strategy = new Strategy(null, null, null, null, null, null, null, null, null, null);
    }
    if (binance == null) {
      binance = new Binance(null, null, null, null, null);
    }
    if (chain == null) {
      chain = new Chain(null);
    }
    if (telegram == null) {
      telegram = new Telegram(null, null, null, null);
    }
    if (message == null) {
      message = new Message(null);
    }
    if (risk == null) {
      risk = new Risk(null, null);
    }
  }

  private static Rest defaultRest() {
    return new Rest(null, null);
  }

  private static RateLimit defaultRateLimit() {
    return new RateLimit(null, null, null);
  }

  private static Retry defaultRetry() {
    return new Retry(null, null, null, null);
  }

  public enum TradingMode {
    PAPER,
    LIVE,
  }

  public record Strategy(
      @NotNull Boolean enabled,
      String ownerAddress,
      /**
       * NonfungiblePositionManager contract holding the LP position NFTs.
       */
      String positionManagerAddress,
      String baseTokenAddress,
      String usdtTokenAddress,
      String symbol,
      /**
       * n: rebalance only when the delta ratio is strictly above this.
       */
      @NotNull Double ratioThreshold,
      /**
       * m: rebalance only when |delta| is strictly above this; also the order quantity step.
       */
      @NotNull @Positive Double deltaThreshold,
      /**
       * Base asset name used in status messages.
       */
      String label,
      @NotNull @Min(1_000) Long pollIntervalMillis
  ) {
    public Strategy {
      if (enabled == null) {
        enabled = true;
      }
      if (ownerAddress == null) {
        ownerAddress = "";
      }
      if (positionManagerAddress == null || positionManagerAddress.isBlank()) {
        // PancakeSwap V3 NonfungiblePositionManager on BSC
        positionManagerAddress = "0x46A15B0b27311cedF172AB29E4f4766fbE7F4364";
      }
      if (baseTokenAddress == null || baseTokenAddress.isBlank()) {
        // WBNB (BSC)
        baseTokenAddress = "0xbb4CdB9CBd36B01bD1cBaEBF2De08d9173bc095c";
      }
      if (usdtTokenAddress == null || usdtTokenAddress.isBlank()) {
        // USDT (BSC)
        usdtTokenAddress = "0x55d398326f99059fF775485246999027B3197955";
      }
      if (symbol == null || symbol.isBlank()) {
        symbol = "BNBUSDC";
      }
      if (ratioThreshold == null) {
        ratioThreshold = 0.05;
      }
      if (deltaThreshold == null) {
        deltaThreshold = 0.1;
      }
      if (label == null || label.isBlank()) {
        label = "BNB";
      }
      if (pollIntervalMillis == null) {
        pollIntervalMillis = 90_000L;
      }
    }
  }

  public record Binance(
      String restUrl,
      String apiKey,
      String apiSecret,
      @NotNull @Min(1) Long recvWindowMillis,
      @Valid Rest rest
  ) {
    public Binance {
      if (restUrl == null || restUrl.isBlank()) {
        restUrl = "https://fapi.binance.com";
      }
      if (apiKey == null) {
        apiKey = "";
      }
      if (apiSecret == null) {
        apiSecret = "";
      }
      if (recvWindowMillis == null) {
        recvWindowMillis = 5_000L;
      }
      if (rest == null) {
        rest = defaultRest();
      }
    }

    public boolean hasCredentials() {
      return !apiKey.isBlank() && !apiSecret.isBlank();
    }

    @Override
    public String toString() {
      return "Binance[restUrl=" + restUrl + ", apiKey=" + (apiKey.isBlank() ? "" : "***")
          + ", recvWindowMillis=" + recvWindowMillis + ", rest=" + rest + "]";
    }
  }

  public record Chain(
      /**
       * JSON-RPC endpoint of the chain the LP positions live on.
       */
      String rpcUrl
  ) {
    public Chain {
      if (rpcUrl == null || rpcUrl.isBlank()) {
        rpcUrl = "https://bsc-dataseed.bnbchain.org";
      }
    }
  }

  public record Telegram(
      @NotNull Boolean enabled,
      String apiUrl,
      String botToken,
      String chatId
  ) {
    public Telegram {
      if (enabled == null) {
        enabled = false;
      }
      if (apiUrl == null || apiUrl.isBlank()) {
        apiUrl = "https://api.telegram.org";
      }
      if (botToken == null) {
        botToken = "";
      }
      if (chatId == null) {
        chatId = "";
      }
    }

    @Override
    public String toString() {
      return "Telegram[enabled=" + enabled + ", apiUrl=" + apiUrl + ", botToken="
          + (botToken.isBlank() ? "" : "***") + ", chatId=" + chatId + "]";
    }
  }

  public record Message(
      /**
       * Status message template with {name} placeholders. Blank uses the built-in English template.
       */
      String template
  ) {
    public Message {
      if (template == null) {
        template = "";
      }
    }
  }

  public record Risk(
      @NotNull Boolean killSwitch,
      /**
       * Largest single hedge order, in base units. 0 disables the check.
       */
      @NotNull @PositiveOrZero BigDecimal maxOrderQuantity
  ) {
    public Risk {
      if (killSwitch == null) {
        killSwitch = false;
      }
      if (maxOrderQuantity == null) {
        maxOrderQuantity = BigDecimal.ZERO;
      }
    }
  }

  public record Rest(@Valid RateLimit rateLimit, @Valid Retry retry) {
    public Rest {
      if (rateLimit == null) {
        rateLimit = defaultRateLimit();
      }
      if (retry == null) {
        retry = defaultRetry();
      }
    }
  }

  public record RateLimit(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double requestsPerSecond,
      @NotNull @PositiveOrZero Integer burst
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (requestsPerSecond == null) {
        requestsPerSecond = 10.0;
      }
      if (burst == null) {
        burst = 20;
      }
    }
  }

  public record Retry(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @PositiveOrZero Long maxBackoffMillis
  ) {
    public Retry {
      if (enabled == null) {
        enabled = true;
      }
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 200L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 2_000L;
      }
    }
  }
}
