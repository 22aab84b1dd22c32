package com.prudhvi.event_stream.event;

import java.util.function.Consumer;

/**
 * Publish/subscribe channel between the platform services and the stream service.
 *
 * Delivery is at-least-once from the bus point of view; the stream service does
 * not deduplicate. Subscribers are invoked on the bus' own delivery thread and
 * must hand slow work off instead of blocking it.
 */
public interface EventBus {

    void publish(BusEvent event);

    Subscription subscribe(Consumer<BusEvent> listener);

    /**
     * Handle returned by {@link #subscribe}. Closing it is idempotent.
     */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
