package com.myorg.msgstore.kafka;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KafkaProducerAutoConfigurationTest {

    private final KafkaProducerAutoConfiguration config = new KafkaProducerAutoConfiguration();

    @Test
    void defaultPropertiesBuildARealProducer() {
        ProducerFactory<String, byte[]> pf = config.producerFactory(new KafkaProperties());

        Producer<String, byte[]> producer = pf.createProducer();
        try {
            assertThat(producer).isNotNull();
        } finally {
            producer.close(Duration.ZERO);
            pf.reset();
        }
    }

    @Test
    void deliveryTimeoutCoversLingerPlusRequestTimeout() {
        KafkaProperties props = new KafkaProperties();
        props.getProducer().setLingerMs(20);
        props.getProducer().setSendTimeout(Duration.ofSeconds(2));

        Map<String, Object> cfg = config.producerFactory(props).getConfigurationProperties();

        int linger = (int) cfg.get(ProducerConfig.LINGER_MS_CONFIG);
        int request = (int) cfg.get(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG);
        int delivery = (int) cfg.get(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG);
        assertThat(delivery).isEqualTo(2_000).isGreaterThanOrEqualTo(linger + request);
        assertThat(request).isPositive();
    }

    @Test
    void sendTimeoutShorterThanLingerStillBuildsAProducer() {
        KafkaProperties props = new KafkaProperties();
        props.getProducer().setLingerMs(50);
        props.getProducer().setSendTimeout(Duration.ofMillis(10));
        ProducerFactory<String, byte[]> pf = config.producerFactory(props);

        Map<String, Object> cfg = pf.getConfigurationProperties();
        assertThat((int) cfg.get(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG))
                .isGreaterThanOrEqualTo(50 + (int) cfg.get(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG));

        Producer<String, byte[]> producer = pf.createProducer();
        producer.close(Duration.ZERO);
        pf.reset();
    }
}
