package com.myorg.msgstore.kafka;

import com.myorg.msgstore.contracts.core.delivery.DeliveryHandler;
import com.myorg.msgstore.kafka.broker.BrokerConnectivityProbe;
import com.myorg.msgstore.kafka.broker.BrokerReaderFactory;
import com.myorg.msgstore.kafka.broker.BrokerWriter;
import com.myorg.msgstore.kafka.broker.KafkaBrokerReader;
import com.myorg.msgstore.kafka.consume.DeliveryHandlerRegistry;
import com.myorg.msgstore.kafka.metrics.MessageStoreMetrics;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(
        before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class,
        after = {KafkaAutoConfiguration.class, KafkaProducerAutoConfiguration.class}
)
@ConditionalOnClass(ConsumerFactory.class)
@EnableConfigurationProperties(KafkaProperties.class)
public class KafkaConsumerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ConsumerFactory<String, byte[]> consumerFactory(KafkaProperties props) {
        Map<String, Object> c = new HashMap<>();
        c.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getAddress());
        c.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        c.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);

        c.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, props.getConsumer().getMaxPollRecords());
        // offsets are committed by the consumption loop, only after successful delivery
        c.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        c.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, props.getConsumer().getAutoOffsetReset());

        if (StringUtils.hasText(props.getGroupId())) {
            c.put(ConsumerConfig.GROUP_ID_CONFIG, props.getGroupId());
        }
        return new DefaultKafkaConsumerFactory<>(c);
    }

    /** Every {@link DeliveryHandler} bean is registered, in {@code @Order} order. */
    @Bean
    @ConditionalOnMissingBean
    public DeliveryHandlerRegistry deliveryHandlerRegistry(ObjectProvider<DeliveryHandler> handlers) {
        DeliveryHandlerRegistry registry = new DeliveryHandlerRegistry();
        handlers.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerReaderFactory brokerReaderFactory(ConsumerFactory<String, byte[]> consumerFactory, KafkaProperties props) {
        return () -> KafkaBrokerReader.subscribe(
                consumerFactory.createConsumer(),
                props.getTopic(),
                props.getConsumer().getPollTimeout(),
                props.getConsumer().getCommitTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaMessageBus kafkaMessageBus(KafkaProperties props,
                                           BrokerConnectivityProbe probe,
                                           BrokerReaderFactory readerFactory,
                                           BrokerWriter writer,
                                           DeliveryHandlerRegistry registry,
                                           ObjectProvider<MessageStoreMetrics> metricsProvider) {
        return new KafkaMessageBus(props, probe, readerFactory, writer, registry, metricsProvider.getIfAvailable());
    }
}
