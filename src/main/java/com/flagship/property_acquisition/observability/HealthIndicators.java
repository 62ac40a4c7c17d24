package com.flagship.property_acquisition.observability;

import com.flagship.property_acquisition.outbox.OutboxEventRepository;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Custom health indicators exposed through {@code /actuator/health}.
 */
public class HealthIndicators {

    /**
     * Down when acquisition events pile up unpublished.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the payment reference fast path, so an outage degrades the
     * service instead of taking it down.
     */
    @Component("paymentReferenceCacheHealth")
    public static class PaymentReferenceCacheHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public PaymentReferenceCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (var connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return degraded("Unexpected ping response: " + result);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Payment references fall back to the database")
                    .build();
        }
    }

    /**
     * Up when the broker answers a cluster description within the timeout.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private static final long TIMEOUT_MS = 3000;

        private final KafkaAdmin kafkaAdmin;

        public KafkaHealthIndicator(KafkaAdmin kafkaAdmin) {
            this.kafkaAdmin = kafkaAdmin;
        }

        @Override
        public Health health() {
            Map<String, Object> config = new HashMap<>(kafkaAdmin.getConfigurationProperties());
            config.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) TIMEOUT_MS);
            try (AdminClient client = AdminClient.create(config)) {
                DescribeClusterResult cluster = client.describeCluster();
                String clusterId = cluster.clusterId().get(TIMEOUT_MS, TimeUnit.MILLISECONDS);
                int nodes = cluster.nodes().get(TIMEOUT_MS, TimeUnit.MILLISECONDS).size();
                return Health.up()
                        .withDetail("clusterId", clusterId)
                        .withDetail("nodes", nodes)
                        .build();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Health.down().withDetail("error", "Interrupted").build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
