package com.flagship.property_acquisition;

import com.flagship.property_acquisition.client.Client;
import com.flagship.property_acquisition.client.ClientStore;
import com.flagship.property_acquisition.property.HandoverStatus;
import com.flagship.property_acquisition.property.Property;
import com.flagship.property_acquisition.property.PropertyStore;
import com.flagship.property_acquisition.property.SubdivisionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

import java.math.BigDecimal;
import java.util.UUID;

import static org.mockito.Mockito.when;

/**
 * Shared PostgreSQL container and fixtures for the integration tests.
 *
 * The container is started once per JVM so that every test class can share the cached
 * Spring context. Redis is mocked (cache misses everywhere, the database is the source
 * of truth) and Kafka is pointed at a closed port with the publisher and consumer off.
 */
@SpringBootTest
public abstract class IntegrationTestSupport {

    protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("property_acquisition_test")
            .withUsername("test")
            .withPassword("test");

    static {
        postgres.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @MockBean
    protected StringRedisTemplate redisTemplate;

    @MockBean
    protected ValueOperations<String, String> valueOperations;

    @Autowired
    protected ClientStore clientStore;

    @Autowired
    protected PropertyStore propertyStore;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void wireRedisMock() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    // Helper methods for test output
    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    protected Client createClient(String fullName) {
        Client client = Client.builder()
                .id(UUID.randomUUID())
                .authUserId("auth-" + UUID.randomUUID())
                .fullName(fullName)
                .email(UUID.randomUUID() + "@example.com")
                .phone("+254700000000")
                .build();
        clientStore.insert(client);
        return client;
    }

    protected Property createProperty(BigDecimal askingPrice) {
        Property property = Property.builder()
                .id(UUID.randomUUID())
                .name("Plot " + UUID.randomUUID().toString().substring(0, 8))
                .askingPrice(askingPrice)
                .handoverStatus(HandoverStatus.NOT_STARTED)
                .subdivisionStatus(SubdivisionStatus.NOT_STARTED)
                .build();
        propertyStore.insert(property);
        return property;
    }

    protected Property reload(Property property) {
        return propertyStore.findById(property.getId()).orElseThrow();
    }

    protected int countPipelines(UUID propertyId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM handover_pipeline WHERE property_id = ?", Integer.class, propertyId);
        return count != null ? count : 0;
    }
}
