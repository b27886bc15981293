package de.bsommerfeld.g11n.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} that carries locale changes and
 * diagnostics from the services to whoever listens.
 *
 * <p>
 * Delivery is synchronous on the posting thread. Subscribers of one event type
 * are called in registration order, and a subscriber that throws is logged and
 * skipped so the remaining subscribers still receive the event.
 */
@Singleton
public class G11nEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(G11nEventBus.class);
    private final EventBus eventBus;

    public G11nEventBus() {
        this.eventBus = new EventBus(G11nEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        LOG.trace("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        try {
            eventBus.unregister(listener);
        } catch (IllegalArgumentException e) {
            LOG.debug("Listener {} was not registered", listener.getClass().getName());
        }
    }

    private static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Listener {} failed while handling {}",
                context.getSubscriber().getClass().getName(), context.getEvent(), exception);
    }
}
