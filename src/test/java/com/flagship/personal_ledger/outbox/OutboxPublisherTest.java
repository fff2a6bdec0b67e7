package com.flagship.personal_ledger.outbox;

import com.flagship.personal_ledger.LedgerIntegrationTestSupport;
import com.flagship.personal_ledger.outbox.event.TransferCreatedEvent;
import com.flagship.personal_ledger.transfer.PairingManager;
import com.flagship.personal_ledger.transfer.Transfer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox relay to Kafka.
 *
 * The scheduled poll is stretched out so each test drives the publisher itself.
 */
class OutboxPublisherTest extends LedgerIntegrationTestSupport {

    static final KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    static {
        kafka.start();
    }

    @DynamicPropertySource
    static void configureKafka(DynamicPropertyRegistry registry) {
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private PairingManager pairingManager;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    private KafkaConsumer<String, String> consumer;
    private UUID checking;
    private UUID savings;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        checking = account("Checking", "500.00");
        savings = account("Savings");

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(ledgerEventsTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    @Test
    @DisplayName("Publisher sends transfer events keyed by aggregate id and marks them published")
    void publishesTransferEvents() {
        printTestHeader("Publisher Sends Events to Kafka");

        Set<String> outgoingIds = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            Transfer transfer = pairingManager.createTransfer(ownerId, checking, savings, amount("10.00"),
                LocalDate.of(2025, 11, 3).plusDays(i), null, null);
            outgoingIds.add(transfer.getOutgoing().getId().toString());
        }
        assertEquals(3, outboxService.countUnpublished());

        outboxPublisher.triggerPublish();

        assertEquals(0, outboxService.countUnpublished());
        List<ConsumerRecord<String, String>> records = consumeRecords(3, 10000);
        printOutput("Records received", records.size());

        assertEquals(3, records.size());
        for (ConsumerRecord<String, String> record : records) {
            printOutput("Key", record.key() + " partition=" + record.partition());
            assertTrue(outgoingIds.contains(record.key()));
            assertTrue(record.value().contains(TransferCreatedEvent.EVENT_TYPE)
                || record.value().contains("outgoingTransactionId"));
        }
        printSuccess("Events published and marked");
    }

    private List<ConsumerRecord<String, String>> consumeRecords(int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && allRecords.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(200));
            for (ConsumerRecord<String, String> record : records) {
                allRecords.add(record);
            }
        }
        return allRecords;
    }
}
