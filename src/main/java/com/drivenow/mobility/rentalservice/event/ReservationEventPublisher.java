package com.drivenow.mobility.rentalservice.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes reservation changes keyed by vehicle id, so all events of one vehicle land on the same
 * partition in commit order. Called only after the change is committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationEventPublisher {

    private final KafkaTemplate<String, ReservationEvent> kafkaTemplate;

    @Value("${spring.kafka.topic.reservation-events}")
    private String topic;

    public void publish(ReservationEvent event) {
        try {
            kafkaTemplate.send(topic, event.vehicleId().toString(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish {} for reservation {}", event.type(), event.reservationId(), ex);
                        } else {
                            log.debug("Published {} for reservation {} at offset {}", event.type(),
                                    event.reservationId(), result.getRecordMetadata().offset());
                        }
                    });
        } catch (Exception e) {
            log.warn("Failed to publish {} for reservation {}", event.type(), event.reservationId(), e);
        }
    }
}
