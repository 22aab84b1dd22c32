package com.prudhvi.event_stream.event;

import com.prudhvi.event_stream.config.EventStreamProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Event bus backed by a Kafka topic.
 *
 * Publishing is fire-and-forget: we do not block waiting for broker acknowledgment,
 * a failed send is logged at WARN and the producing request is unaffected.
 *
 * Consuming: every replica of this service must see every event, because each replica
 * holds its own set of client streams. The listener's group id therefore embeds a random
 * UUID resolved at startup, giving each instance an independent consumer group.
 * auto-offset-reset = latest (application.yaml) means nothing published before the
 * instance started is replayed.
 *
 * Key: tenantId, so events for one tenant stay ordered within a partition.
 */
@Component
public class KafkaEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventBus.class);

    private final KafkaTemplate<String, BusEvent> kafka;
    private final String topic;

    // Iterated on every consumed record while subscribers come and go.
    private final List<Consumer<BusEvent>> listeners = new CopyOnWriteArrayList<>();

    public KafkaEventBus(KafkaTemplate<String, BusEvent> kafka,
                         EventStreamProperties properties) {
        this.kafka = kafka;
        this.topic = properties.getBus().getTopic();
    }

    public String getTopic() {
        return topic;
    }

    @Override
    public void publish(BusEvent event) {
        kafka.send(topic, event.tenantId(), event)
             .exceptionally(ex -> {
                 log.warn("Event bus publish failed for tenant={} type={}: {}",
                         event.tenantId(), event.type(), ex.getMessage());
                 return null;
             });
    }

    @Override
    public Subscription subscribe(Consumer<BusEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @KafkaListener(topics = "#{__listener.topic}",
                   groupId = "event-stream-${random.uuid}")
    public void consume(BusEvent event) {
        dispatch(event);
    }

    /**
     * Hands the event to every local subscriber. One failing subscriber is logged
     * and skipped; the rest still receive the event.
     */
    void dispatch(BusEvent event) {
        for (Consumer<BusEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Event bus subscriber failed on type={}: {}", event.type(), e.getMessage(), e);
            }
        }
    }

    int subscriberCount() {
        return listeners.size();
    }
}
