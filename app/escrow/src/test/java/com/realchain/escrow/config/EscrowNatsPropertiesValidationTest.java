/*
 * どこで: Escrow 設定バインドのバリデーションテスト
 * 何を: escrow.nats の必須設定と duplicate window の正値を検証する
 * なぜ: 起動時に設定不備を検知して publish 時の失敗を防ぐため
 */
package com.realchain.escrow.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.assertj.AssertableApplicationContext;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ContextConsumer;
import org.springframework.context.annotation.Configuration;

class EscrowNatsPropertiesValidationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void contextFailsWhenSubjectIsMissing() {
    contextRunner.run(assertValidationFailure("subject"));
  }

  @Test
  void contextFailsWhenStreamIsBlank() {
    contextRunner
        .withPropertyValues(
            "escrow.nats.subject=escrow.deal.events",
            "escrow.nats.stream=   ",
            "escrow.nats.duplicate-window=2m")
        .run(assertValidationFailure("stream"));
  }

  @Test
  void contextFailsWhenDuplicateWindowIsMissing() {
    contextRunner
        .withPropertyValues(
            "escrow.nats.subject=escrow.deal.events", "escrow.nats.stream=escrow-deal-events")
        .run(assertValidationFailure("duplicate"));
  }

  @Test
  void contextFailsWhenDuplicateWindowIsNotPositive() {
    contextRunner
        .withPropertyValues(
            "escrow.nats.subject=escrow.deal.events",
            "escrow.nats.stream=escrow-deal-events",
            "escrow.nats.duplicate-window=0s")
        .run(assertValidationFailure("escrow.nats.duplicate-window must be positive"));
  }

  @Test
  void contextStartsWhenAllValuesArePresent() {
    contextRunner
        .withPropertyValues(
            "escrow.nats.subject=escrow.deal.events",
            "escrow.nats.stream=escrow-deal-events",
            "escrow.nats.duplicate-window=2m")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final EscrowNatsProperties properties = context.getBean(EscrowNatsProperties.class);
              assertThat(properties.subject()).isEqualTo("escrow.deal.events");
              assertThat(properties.stream()).isEqualTo("escrow-deal-events");
              assertThat(properties.duplicateWindow()).isNotNull();
            });
  }

  private ContextConsumer<AssertableApplicationContext> assertValidationFailure(
      String expectedField) {
    return context -> {
      assertThat(context).hasFailed();
      final Throwable root =
          org.assertj.core.util.Throwables.getRootCause(context.getStartupFailure());
      assertThat(root).isInstanceOf(BindValidationException.class);
      assertThat(root.getMessage()).contains(expectedField);
    };
  }

  @Configuration
  @EnableConfigurationProperties(EscrowNatsProperties.class)
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
