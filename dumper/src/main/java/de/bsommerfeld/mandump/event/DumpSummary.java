package de.bsommerfeld.mandump.event;

import com.google.common.eventbus.AllowConcurrentEvents;
import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.mandump.extract.ExtractionResult.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts package outcomes and written paths over a run.
 */
public class DumpSummary {

    private static final Logger LOG = LoggerFactory.getLogger(DumpSummary.class);

    private final Map<Outcome, AtomicLong> outcomes = new EnumMap<>(Outcome.class);
    private final AtomicLong extractedPaths = new AtomicLong();

    public DumpSummary() {
        for (Outcome outcome : Outcome.values()) {
            outcomes.put(outcome, new AtomicLong());
        }
    }

    @Subscribe
    @AllowConcurrentEvents
    public void onPackageDumped(PackageDumpedEvent event) {
        outcomes.get(event.result().outcome()).incrementAndGet();
        if (event.result().outcome() == Outcome.EXTRACTED) {
            extractedPaths.addAndGet(event.result().paths().size());
        }
    }

    public long count(Outcome outcome) {
        return outcomes.get(outcome).get();
    }

    public long total() {
        return outcomes.values().stream().mapToLong(AtomicLong::get).sum();
    }

    public long extractedPaths() {
        return extractedPaths.get();
    }

    public void log() {
        LOG.info("Processed {} packages: {} extracted ({} files), {} cached, {} skipped, {} irrelevant, {} missing",
                total(), count(Outcome.EXTRACTED), extractedPaths(), count(Outcome.CACHED),
                count(Outcome.SKIPPED), count(Outcome.IRRELEVANT), count(Outcome.MISSING));
    }
}
