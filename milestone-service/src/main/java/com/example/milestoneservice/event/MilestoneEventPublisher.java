package com.example.milestoneservice.event;

import com.example.common.events.MilestoneUpdatedEvent;
import com.example.milestoneservice.security.CorrelationIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.nio.charset.StandardCharsets;

/**
 * Event Publisher for Milestone Service
 *
 * Publish events:
 * - MilestoneUpdatedEvent: after a milestone update transaction commits
 *
 * Runs as an AFTER_COMMIT listener: a rolled back update never publishes, and a
 * failed publish never rolls back an update. Failures are logged, not retried.
 */
@Slf4j
@Component
public class MilestoneEventPublisher {

    private final KafkaTemplate<String, MilestoneUpdatedEvent> kafkaTemplate;
    private final String milestoneUpdatedTopic;

    public MilestoneEventPublisher(KafkaTemplate<String, MilestoneUpdatedEvent> kafkaTemplate,
                                   @Value("${milestone.events.topic:milestone.updated}") String milestoneUpdatedTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.milestoneUpdatedTopic = milestoneUpdatedTopic;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void publishMilestoneUpdated(MilestoneUpdatedEvent event) {
        Long milestoneId = event.getUpdated().getId();
        log.debug("Sending event to Kafka topic {} for milestone {}", milestoneUpdatedTopic, milestoneId);

        try {
            ProducerRecord<String, MilestoneUpdatedEvent> record =
                    new ProducerRecord<>(milestoneUpdatedTopic, milestoneId.toString(), event);
            if (event.getCorrelationId() != null) {
                record.headers().add(CorrelationIdFilter.CORRELATION_ID_HEADER,
                        event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
            }

            kafkaTemplate.send(record)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            log.info("MilestoneUpdatedEvent published successfully: milestoneId={}", milestoneId);
                        } else {
                            log.error("Failed to publish MilestoneUpdatedEvent: milestoneId={}", milestoneId, ex);
                        }
                    });
        } catch (Exception e) {
            // The update is already committed; publishing is best effort
            log.error("Error publishing MilestoneUpdatedEvent: milestoneId={}", milestoneId, e);
        }
    }
}
