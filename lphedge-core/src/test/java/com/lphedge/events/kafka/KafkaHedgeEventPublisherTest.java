package com.lphedge.events.kafka;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lphedge.events.HedgeEventTypes;
import com.lphedge.events.HedgeEventsProperties;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class KafkaHedgeEventPublisherTest {

  @SuppressWarnings("unchecked")
  private final KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC);

  @Test
  void publishesEnvelopeKeyedBySymbol() throws Exception {
    when(kafkaTemplate.send(eq("lphedge.events"), eq("BNBUSDC"), anyString()))
        .thenReturn(CompletableFuture.completedFuture(null));
    KafkaHedgeEventPublisher publisher = new KafkaHedgeEventPublisher(
        new HedgeEventsProperties(true, null), kafkaTemplate, objectMapper, clock, "Strategy-Service");

    publisher.publish(HedgeEventTypes.STRATEGY_LPH_ORDER, "BNBUSDC", Map.of("quantity", "7.0"));

    ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
    verify(kafkaTemplate).send(eq("lphedge.events"), eq("BNBUSDC"), json.capture());
    JsonNode envelope = objectMapper.readTree(json.getValue());
    assertThat(envelope.get("source").asText()).isEqualTo("strategy-service");
    assertThat(envelope.get("type").asText()).isEqualTo("strategy.lph.order");
    assertThat(envelope.get("data").get("quantity").asText()).isEqualTo("7.0");
    assertThat(envelope.has("ts")).isTrue();
  }

  @Test
  void sendFailureIsCountedNotThrown() {
    when(kafkaTemplate.send(eq("lphedge.events"), anyString()))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
    KafkaHedgeEventPublisher publisher = new KafkaHedgeEventPublisher(
        new HedgeEventsProperties(true, null), kafkaTemplate, objectMapper, clock, "strategy-service");

    publisher.publish(HedgeEventTypes.STRATEGY_LPH_SNAPSHOT, null, Map.of());

    assertThat(publisher.failureCount()).isEqualTo(1L);
  }

  @Test
  void disabledPublisherSendsNothing() {
    KafkaHedgeEventPublisher publisher = new KafkaHedgeEventPublisher(
        new HedgeEventsProperties(false, null), kafkaTemplate, objectMapper, clock, "strategy-service");

    publisher.publish(HedgeEventTypes.STRATEGY_LPH_SNAPSHOT, "BNBUSDC", Map.of());

    assertThat(publisher.isEnabled()).isFalse();
    verifyNoInteractions(kafkaTemplate);
  }
}
