package com.myorg.msgstore.kafka;

import com.myorg.msgstore.kafka.broker.BrokerWriter;
import com.myorg.msgstore.kafka.broker.KafkaTemplateBrokerWriter;
import com.myorg.msgstore.kafka.metrics.MessageStoreMetrics;
import com.myorg.msgstore.kafka.publish.DefaultMessagePublisher;
import com.myorg.msgstore.kafka.publish.MessagePublisher;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

// Producer side: payloads go out as raw bytes, key as string.
@AutoConfiguration(
        before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class,
        after = KafkaAutoConfiguration.class
)
@ConditionalOnClass(KafkaTemplate.class)
@EnableConfigurationProperties(KafkaProperties.class)
public class KafkaProducerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ProducerFactory<String, byte[]> producerFactory(KafkaProperties props) {
        Map<String, Object> p = new HashMap<>();
        p.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getAddress());
        p.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        p.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);

        p.put(ProducerConfig.ACKS_CONFIG, props.getProducer().getAcks());
        p.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, props.getProducer().isIdempotence());
        p.put(ProducerConfig.RETRIES_CONFIG, props.getProducer().getRetries());
        p.put(ProducerConfig.LINGER_MS_CONFIG, props.getProducer().getLingerMs());
        p.put(ProducerConfig.BATCH_SIZE_CONFIG, props.getProducer().getBatchSize());
        // the client gives up on its own before our synchronous wait does;
        // kafka rejects delivery.timeout.ms < linger.ms + request.timeout.ms
        long sendMs = Math.min(Integer.MAX_VALUE, props.getProducer().getSendTimeout().toMillis());
        long lingerMs = Math.max(0, props.getProducer().getLingerMs());
        long requestMs = Math.max(1, sendMs - lingerMs);
        long deliveryMs = Math.min(Integer.MAX_VALUE, Math.max(sendMs, lingerMs + requestMs));
        p.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) requestMs);
        p.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, (int) deliveryMs);
        return new DefaultKafkaProducerFactory<>(p);
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaTemplate<String, byte[]> kafkaTemplate(ProducerFactory<String, byte[]> pf) {
        return new KafkaTemplate<>(pf);
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerWriter brokerWriter(KafkaTemplate<String, byte[]> kafkaTemplate, KafkaProperties props) {
        return new KafkaTemplateBrokerWriter(kafkaTemplate, props.getProducer().getSendTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagePublisher messagePublisher(BrokerWriter writer,
                                             KafkaProperties props,
                                             ObjectProvider<MessageStoreMetrics> metricsProvider) {
        return new DefaultMessagePublisher(writer, props.getTopic(), metricsProvider.getIfAvailable());
    }
}
