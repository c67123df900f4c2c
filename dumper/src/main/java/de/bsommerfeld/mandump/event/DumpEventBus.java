package de.bsommerfeld.mandump.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import de.bsommerfeld.mandump.extract.ExtractionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes per-package results of a dump run to listeners such as {@link DumpSummary}.
 *
 * <p>Events are dispatched on the worker thread that finished the package. A failing
 * listener is logged through SLF4J and never fails the package that triggered it.
 */
@Singleton
public class DumpEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(DumpEventBus.class);

    private final EventBus bus = new EventBus(DumpEventBus::listenerFailed);

    /**
     * Reports that {@code pkgver} from {@code repository} has been recorded in the cache.
     */
    public void packageDumped(String repository, String pkgver, ExtractionResult result) {
        PackageDumpedEvent event = new PackageDumpedEvent(repository, pkgver, result);
        LOG.trace("{}: {} {}", repository, pkgver, result.outcome());
        bus.post(event);
    }

    public void register(Object listener) {
        bus.register(listener);
    }

    public void unregister(Object listener) {
        bus.unregister(listener);
    }

    private static void listenerFailed(Throwable failure, SubscriberExceptionContext context) {
        LOG.warn("Listener {}.{} failed on {}",
                context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(),
                context.getEvent(), failure);
    }
}
