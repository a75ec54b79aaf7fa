package com.lphedge.strategy.web;

import com.lphedge.binance.BinanceFuturesClient;
import com.lphedge.binance.model.FundingRate;
import com.lphedge.config.HedgeProperties;
import com.lphedge.strategy.LphStrategyRunner;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/strategy")
@RequiredArgsConstructor
public class StrategyStatusController {

  private final @NonNull HedgeProperties properties;
  private final @NonNull Environment environment;
  private final @NonNull ObjectProvider<LphStrategyRunner> runner;
  private final @NonNull BinanceFuturesClient futuresClient;

  @GetMapping("/status")
  public ResponseEntity<StrategyStatusResponse> status() {
    HedgeProperties.Strategy strategy = properties.strategy();
    LphStrategyRunner active = runner.getIfAvailable();
    return ResponseEntity.ok(new StrategyStatusResponse(
        properties.mode().name(),
        environment.getActiveProfiles(),
        strategy.symbol(),
        strategy.label(),
        strategy.ratioThreshold(),
        strategy.deltaThreshold(),
        strategy.pollIntervalMillis(),
        properties.telegram().enabled(),
        properties.risk().killSwitch(),
        active == null ? LphStrategyRunner.RunnerStatus.disabled() : active.status()
    ));
  }

  @GetMapping("/funding")
  public ResponseEntity<List<FundingRate>> funding(@RequestParam(name = "limit", defaultValue = "10") int limit) {
    return ResponseEntity.ok(futuresClient.fundingRates(properties.strategy().symbol(), limit));
  }

  public record StrategyStatusResponse(String mode, String[] activeProfiles, String symbol, String label,
                                       double ratioThreshold, double deltaThreshold, long pollIntervalMillis,
                                       boolean telegramEnabled, boolean killSwitch,
                                       LphStrategyRunner.RunnerStatus runner) {
  }
}
