package com.cred.freestyle.registration.infrastructure.messaging;

import com.cred.freestyle.registration.infrastructure.messaging.events.RegistrationEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer service for registration lifecycle events.
 * Publishing is fire-and-forget: a failed send is logged and never affects the committed transaction.
 *
 * Topic partitioning strategy:
 * - Key: {kind}:{offeringId}, so all events of one offering are ordered
 *
 * @author Registration Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    static final String REGISTRATION_TOPIC = "offering-registrations";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public KafkaProducerService(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Publish a registration lifecycle event.
     *
     * @param event Registration event
     */
    public void publishRegistrationEvent(RegistrationEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    REGISTRATION_TOPIC,
                    event.partitionKey(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} event for registration {}, offering: {}, partition: {}",
                            event.getEventType(), event.getRegistrationId(), event.partitionKey(),
                            result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} event for registration {}, offering: {}",
                            event.getEventType(), event.getRegistrationId(), event.partitionKey(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} event for registration {}",
                    event.getEventType(), event.getRegistrationId(), e);
        } catch (Exception e) {
            logger.error("Error sending {} event for registration {}",
                    event.getEventType(), event.getRegistrationId(), e);
        }
    }
}
