package com.flagship.recurring_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.recurring_ledger.account.AccountService;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import com.flagship.recurring_ledger.ledger.event.OccurrencesGeneratedEvent;
import com.flagship.recurring_ledger.ledger.event.OutboxLedgerEventPublisher;
import com.flagship.recurring_ledger.recurring.RecurringSyncService;
import com.flagship.recurring_ledger.recurring.RecurringTemplateService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static com.flagship.recurring_ledger.support.TestOutput.printOutput;
import static com.flagship.recurring_ledger.support.TestOutput.printSuccess;
import static com.flagship.recurring_ledger.support.TestOutput.printTestHeader;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox events reach Kafka keyed by account and are marked published afterwards.
 */
@SpringBootTest(properties = "spring.autoconfigure.exclude="
    + "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration,"
    + "org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration")
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("recurring_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Publisher bean stays, but its schedule only fires once at startup; tests drive it directly
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("ledger.recurring.sync.enabled", () -> "false");
        registry.add("ledger.audit.enabled", () -> "false");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private RecurringTemplateService templateService;

    @Autowired
    private RecurringSyncService syncService;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of(ledgerEventsTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    @Test
    @DisplayName("A generation event is sent keyed by account id and marked published")
    void publishesGeneratedOccurrences() throws Exception {
        printTestHeader("Outbox to Kafka");
        UUID accountId = accountService.openAccount(UUID.randomUUID(), "StarBank 501", null).getId();
        RecurringTemplate template = templateService.createTemplate(RecurringTemplate.create(accountId,
            LocalDate.of(2025, 1, 1), "Landlord", "Rent", new BigDecimal("-1200.00"), "Rent", 30, null, null));
        syncService.syncAccount(accountId, LocalDate.of(2025, 3, 2));

        outboxPublisher.publishPendingEvents();

        ConsumerRecord<String, String> record = pollForKey(accountId.toString());
        printOutput("Payload", record.value());
        JsonNode payload = objectMapper.readTree(record.value());
        assertEquals(OccurrencesGeneratedEvent.EVENT_TYPE, payload.get("eventType").asText());
        assertEquals(template.getId().toString(), payload.get("templateId").asText());
        assertEquals(3, payload.get("count").asInt());
        assertEquals("2025-04-01", payload.get("nextDueDate").asText());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(
            OutboxLedgerEventPublisher.AGGREGATE_TYPE, accountId);
        assertEquals(1, events.size());
        assertTrue(events.get(0).isPublished());
        assertEquals(0, outboxService.countUnpublished());
        printSuccess("Event delivered and acknowledged");
    }

    private ConsumerRecord<String, String> pollForKey(String key) {
        List<ConsumerRecord<String, String>> seen = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 15_000;
        while (System.currentTimeMillis() < deadline) {
            for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofMillis(500))) {
                seen.add(record);
                if (key.equals(record.key())) {
                    return record;
                }
            }
        }
        return fail("No record with key " + key + " within 15s, saw " + seen.size() + " records");
    }
}
