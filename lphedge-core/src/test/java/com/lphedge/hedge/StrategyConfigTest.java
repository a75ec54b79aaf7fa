package com.lphedge.hedge;

import com.lphedge.hedge.error.ErrorKind;
import com.lphedge.hedge.error.HedgeConfigurationException;
import org.junit.jupiter.api.Test;

import static com.lphedge.hedge.HedgeFixtures.OWNER;
import static com.lphedge.hedge.HedgeFixtures.POSITION_MANAGER;
import static com.lphedge.hedge.HedgeFixtures.SYMBOL;
import static com.lphedge.hedge.HedgeFixtures.USDT;
import static com.lphedge.hedge.HedgeFixtures.WBNB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyConfigTest {

  @Test
  void trimsIdentifiers() {
    StrategyConfig cfg = StrategyConfig.of(" " + OWNER + " ", POSITION_MANAGER, WBNB, USDT, " BNBUSDC ", 0.05, 0.1);

    assertThat(cfg.ownerAddress()).isEqualTo(OWNER);
    assertThat(cfg.symbol()).isEqualTo("BNBUSDC");
  }

  @Test
  void allowsNegativeRatioThreshold() {
    assertThat(StrategyConfig.of(OWNER, POSITION_MANAGER, WBNB, USDT, SYMBOL, -0.5, 0.1).ratioThreshold()).isEqualTo(-0.5);
  }

  @Test
  void rejectsNonPositiveStep() {
    assertThatThrownBy(() -> StrategyConfig.of(OWNER, POSITION_MANAGER, WBNB, USDT, SYMBOL, 0.05, 0))
        .isInstanceOfSatisfying(HedgeConfigurationException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFIGURATION));
    assertThatThrownBy(() -> StrategyConfig.of(OWNER, POSITION_MANAGER, WBNB, USDT, SYMBOL, 0.05, -0.1))
        .isInstanceOf(HedgeConfigurationException.class);
  }

  @Test
  void rejectsNonFiniteThresholds() {
    assertThatThrownBy(() -> StrategyConfig.of(OWNER, POSITION_MANAGER, WBNB, USDT, SYMBOL, Double.NaN, 0.1))
        .isInstanceOf(HedgeConfigurationException.class);
    assertThatThrownBy(() -> StrategyConfig.of(OWNER, POSITION_MANAGER, WBNB, USDT, SYMBOL, 0.05, Double.POSITIVE_INFINITY))
        .isInstanceOf(HedgeConfigurationException.class);
  }

  @Test
  void rejectsBlankIdentifiersAndSameToken() {
    assertThatThrownBy(() -> StrategyConfig.of("", POSITION_MANAGER, WBNB, USDT, SYMBOL, 0.05, 0.1))
        .isInstanceOf(HedgeConfigurationException.class)
        .hasMessageContaining("ownerAddress");
    assertThatThrownBy(() -> StrategyConfig.of(OWNER, POSITION_MANAGER, WBNB, USDT, null, 0.05, 0.1))
        .isInstanceOf(HedgeConfigurationException.class)
        .hasMessageContaining("symbol");
    assertThatThrownBy(() -> StrategyConfig.of(OWNER, POSITION_MANAGER, WBNB, WBNB.toLowerCase(), SYMBOL, 0.05, 0.1))
        .isInstanceOf(HedgeConfigurationException.class);
  }
}
