package com.myorg.msgstore.kafka;

import com.myorg.msgstore.kafka.broker.BrokerConnectivityProbe;
import com.myorg.msgstore.kafka.broker.KafkaAdminConnectivityProbe;
import com.myorg.msgstore.kafka.metrics.MessageStoreMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.HashMap;
import java.util.Map;

// Bean nền tảng: KafkaAdmin trỏ vào msgstore.kafka.address, probe kết nối, metrics.
@AutoConfiguration(
        before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
)
@ConditionalOnClass(KafkaAdmin.class)
@EnableConfigurationProperties(KafkaProperties.class)
public class KafkaAutoConfiguration {

    /**
     * KafkaAdmin wired to msgstore.kafka.address.
     * (Spring Boot's default KafkaAdmin looks at spring.kafka.bootstrap-servers, which we don't use.)
     */
    @Bean
    @ConditionalOnMissingBean
    public KafkaAdmin kafkaAdmin(KafkaProperties props) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, props.getAddress());
        return new KafkaAdmin(cfg);
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerConnectivityProbe brokerConnectivityProbe(KafkaProperties props, KafkaAdmin kafkaAdmin) {
        return new KafkaAdminConnectivityProbe(kafkaAdmin, props.getNetwork(), props.getAddress(), props.getProbeTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    public MessageStoreMetrics messageStoreMetrics(MeterRegistry registry, KafkaProperties props) {
        MessageStoreMetrics metrics = new MessageStoreMetrics(registry, props.getTopic());
        metrics.preRegisterBaseMeters();
        return metrics;
    }
}
