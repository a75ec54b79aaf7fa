package com.lphedge.events;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class HedgeEventsConfiguration {

  @Bean
  @ConditionalOnProperty(prefix = "lph.events", name = "enabled", havingValue = "false", matchIfMissing = true)
  @ConditionalOnMissingBean(HedgeEventPublisher.class)
  public HedgeEventPublisher noopHedgeEventPublisher() {
    return new NoopHedgeEventPublisher();
  }
}
