package com.myorg.msgstore.kafka.broker;

import com.myorg.msgstore.contracts.core.exception.BrokerConnectivityException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.common.KafkaException;
import org.springframework.kafka.core.KafkaAdmin;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Checks the broker is reachable by asking it for the cluster id through a short-lived admin client.
 */
@Slf4j
public class KafkaAdminConnectivityProbe implements BrokerConnectivityProbe {

    private final KafkaAdmin kafkaAdmin;
    private final String network;
    private final String address;
    private final Duration timeout;

    public KafkaAdminConnectivityProbe(KafkaAdmin kafkaAdmin, String network, String address, Duration timeout) {
        this.kafkaAdmin = kafkaAdmin;
        this.network = network;
        this.address = address;
        this.timeout = timeout;
    }

    @Override
    public void probe() throws BrokerConnectivityException {
        Map<String, Object> cfg = new HashMap<>(kafkaAdmin.getConfigurationProperties());
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        cfg.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
        cfg.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);

        try (AdminClient client = AdminClient.create(cfg)) {
            String clusterId = client.describeCluster().clusterId().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Kafka reachable network={} address={} clusterId={}", network, address, clusterId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectivityException(network, address, e);
        } catch (ExecutionException e) {
            throw new BrokerConnectivityException(network, address, e.getCause() == null ? e : e.getCause());
        } catch (TimeoutException | KafkaException e) {
            throw new BrokerConnectivityException(network, address, e);
        }
    }
}
