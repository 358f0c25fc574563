package com.myorg.msgstore.kafka;

import com.myorg.msgstore.contracts.core.delivery.DeliveryHandler;
import com.myorg.msgstore.contracts.core.delivery.DeliveryResult;
import com.myorg.msgstore.kafka.broker.BrokerConnectivityProbe;
import com.myorg.msgstore.kafka.broker.BrokerReaderFactory;
import com.myorg.msgstore.kafka.broker.BrokerWriter;
import com.myorg.msgstore.kafka.broker.KafkaAdminConnectivityProbe;
import com.myorg.msgstore.kafka.consume.DeliveryHandlerRegistry;
import com.myorg.msgstore.kafka.metrics.MessageStoreMetrics;
import com.myorg.msgstore.kafka.publish.MessagePublisher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class KafkaAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    KafkaAutoConfiguration.class,
                    KafkaProducerAutoConfiguration.class,
                    KafkaConsumerAutoConfiguration.class))
            .withPropertyValues(
                    "msgstore.kafka.address=broker-1:9092",
                    "msgstore.kafka.topic=messages",
                    "msgstore.kafka.group-id=message-store");

    @Test
    void wiresThePipelineFromMsgstoreProperties() {
        runner.withPropertyValues(
                        "msgstore.kafka.commit-backoff.attempts=5",
                        "msgstore.kafka.fetch-backoff.initial=250ms",
                        "msgstore.kafka.consumer.concurrency=2")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(KafkaMessageBus.class)
                            .hasSingleBean(MessagePublisher.class)
                            .hasSingleBean(BrokerWriter.class)
                            .hasSingleBean(BrokerReaderFactory.class)
                            .hasSingleBean(DeliveryHandlerRegistry.class)
                            .doesNotHaveBean(MessageStoreMetrics.class);
                    assertThat(ctx.getBean(BrokerConnectivityProbe.class)).isInstanceOf(KafkaAdminConnectivityProbe.class);

                    KafkaProperties props = ctx.getBean(KafkaProperties.class);
                    assertThat(props.getCommitBackoff().toPolicy().attempts()).isEqualTo(5);
                    assertThat(props.getFetchBackoff().toPolicy().initial()).isEqualTo(Duration.ofMillis(250));
                    assertThat(props.getFetchBackoff().toPolicy().isUnbounded()).isTrue();
                    assertThat(props.getConsumer().getConcurrency()).isEqualTo(2);

                    ConsumerFactory<?, ?> cf = ctx.getBean(ConsumerFactory.class);
                    assertThat(cf.getConfigurationProperties())
                            .containsEntry(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, "broker-1:9092")
                            .containsEntry(ConsumerConfig.GROUP_ID_CONFIG, "message-store")
                            .containsEntry(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false)
                            .containsEntry(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

                    ProducerFactory<?, ?> pf = ctx.getBean(ProducerFactory.class);
                    assertThat(pf.getConfigurationProperties())
                            .containsEntry(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, "broker-1:9092")
                            .containsEntry(ProducerConfig.ACKS_CONFIG, "all");
                });
    }

    @Test
    void handlerBeansAreRegisteredInOrder() {
        runner.withUserConfiguration(Handlers.class).run(ctx -> {
            DeliveryHandlerRegistry registry = ctx.getBean(DeliveryHandlerRegistry.class);
            assertThat(registry.handlers()).containsExactly(Handlers.FIRST, Handlers.SECOND);
            assertThat(registry.isSealed()).isFalse();
        });
    }

    @Test
    void metricsArePreRegisteredWhenARegistryExists() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new).run(ctx -> {
            assertThat(ctx).hasSingleBean(MessageStoreMetrics.class);
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertThat(registry.find(MessageStoreMetrics.COMMITTED).tag("topic", "messages").counter()).isNotNull();
            assertThat(registry.find(MessageStoreMetrics.FETCH_FAILED).counter()).isNotNull();
        });
    }

    @Test
    void applicationBeansWin() {
        BrokerConnectivityProbe custom = () -> { };
        runner.withBean(BrokerConnectivityProbe.class, () -> custom)
                .run(ctx -> assertThat(ctx.getBean(BrokerConnectivityProbe.class)).isSameAs(custom));
    }

    @Configuration(proxyBeanMethods = false)
    static class Handlers {
        static final DeliveryHandler FIRST = p -> DeliveryResult.success();
        static final DeliveryHandler SECOND = p -> DeliveryResult.success();

        @Bean
        @Order(2)
        DeliveryHandler second() {
            return SECOND;
        }

        @Bean
        @Order(1)
        DeliveryHandler first() {
            return FIRST;
        }
    }
}
