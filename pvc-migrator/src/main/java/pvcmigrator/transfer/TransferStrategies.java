package pvcmigrator.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.config.TransferMethod;
import pvcmigrator.exceptions.MigrateException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the strategy for a requested method, substituting stream-archive when
 * the requested one is not available in the pods.
 */
public class TransferStrategies {

    private static final Logger log = LoggerFactory.getLogger(TransferStrategies.class);

    private final Map<TransferMethod, TransferStrategy> strategies = new EnumMap<>(TransferMethod.class);

    public TransferStrategies() {
        this(List.of(new StreamArchiveTransfer(), new IncrementalSyncTransfer()));
    }

    public TransferStrategies(List<TransferStrategy> available) {
        for (TransferStrategy s : available) {
            strategies.put(s.method(), s);
        }
        if (!strategies.containsKey(TransferMethod.STREAM_ARCHIVE)) {
            throw new IllegalArgumentException("A stream-archive strategy is required as fallback");
        }
    }

    public TransferStrategy select(TransferMethod requested, TransferPlan plan) throws MigrateException {
        TransferStrategy fallback = strategies.get(TransferMethod.STREAM_ARCHIVE);
        TransferStrategy strategy = strategies.get(requested);
        if (strategy == null) {
            log.info("{} not supported; switching to {}", requested, fallback.method());
            return fallback;
        }
        if (strategy != fallback && !strategy.isAvailable(plan)) {
            log.info("{} not available in transfer pods; switching to {}", requested, fallback.method());
            return fallback;
        }
        log.info("Copy method: {}", strategy.method());
        return strategy;
    }
}
