package com.lphedge.events.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lphedge.events.HedgeEventPublisher;
import com.lphedge.events.HedgeEventsProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(KafkaTemplate.class)
public class KafkaHedgeEventsConfiguration {

  @Bean
  @ConditionalOnProperty(prefix = "lph.events", name = "enabled", havingValue = "true")
  public HedgeEventPublisher kafkaHedgeEventPublisher(
      HedgeEventsProperties properties,
      KafkaTemplate<String, String> kafkaTemplate,
      ObjectMapper objectMapper,
      Clock clock,
      Environment env
  ) {
    String source = env.getProperty("spring.application.name", "app");
    return new KafkaHedgeEventPublisher(properties, kafkaTemplate, objectMapper, clock, source);
  }
}
