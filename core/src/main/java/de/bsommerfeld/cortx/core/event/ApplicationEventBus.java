package de.bsommerfeld.cortx.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A simple wrapper around Guava's EventBus to decouple the supervisor from
 * whatever renders its events. Posting happens on the calling thread, which
 * for process events is a pump or exit-watch thread, so subscribers must be
 * thread-safe.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::handleSubscriberException);
    }

    public void post(Object event) {
        // Log lines are far too chatty for debug output
        if (!(event instanceof ProcessEvents.LogEvent)) {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void handleSubscriberException(Throwable exception, SubscriberExceptionContext context) {
        LOG.warn("Listener {} failed on event {}", context.getSubscriber().getClass().getName(),
                context.getEvent(), exception);
    }
}
