package org.nowstart.zonerisk.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.entity.PersistedTouch;
import org.nowstart.zonerisk.data.entity.PersistedZone;
import org.nowstart.zonerisk.data.entity.TouchHistoryDocument;
import org.nowstart.zonerisk.data.exception.PersistenceException;
import org.nowstart.zonerisk.zone.core.Zone;
import org.nowstart.zonerisk.zone.core.ZoneSeed;

/**
 * File-backed store of zone identity and touch history.
 *
 * <p>Writers stage whole symbols with {@link #replaceSymbol}; {@link #flush()} writes everything staged
 * so far to a temporary file and moves it over the target, so a crash leaves either the previous or
 * the new document on disk. Staging and flushing may happen on different threads.
 */
@Slf4j
public class TouchHistoryStore implements AutoCloseable {

    private final ObjectMapper objectMapper;
    private final double priceBucketPct;
    private final Object lock = new Object();
    private final Map<String, PersistedZone> zonesByKey = new LinkedHashMap<>();
    private final Map<String, Double> atrBySymbol = new HashMap<>();
    private Path path;
    private long stagedGeneration;
    private long flushedGeneration;
    private boolean closed;

    public TouchHistoryStore(ObjectMapper objectMapper, double priceBucketPct) {
        this.objectMapper = objectMapper;
        this.priceBucketPct = priceBucketPct;
    }

    /**
     * Binds the store to {@code path} and loads whatever is there. A missing file starts empty; an
     * unreadable one raises {@link PersistenceException}.
     */
    public TouchHistoryStore open(Path path) {
        synchronized (lock) {
            this.path = path;
            this.closed = false;
            zonesByKey.clear();
            atrBySymbol.clear();
            if (!Files.exists(path)) {
                log.info("event=touch_history_open path={} zones=0 status=new", path);
                return this;
            }
            try {
                TouchHistoryDocument document = objectMapper.readValue(path.toFile(), TouchHistoryDocument.class);
                document.zones().forEach(zone -> zonesByKey.put(zone.key(), zone));
                atrBySymbol.putAll(document.atrBySymbol());
                log.info("event=touch_history_open path={} zones={} status=loaded", path, zonesByKey.size());
                return this;
            } catch (IOException e) {
                throw new PersistenceException("Failed to read touch history from " + path, e);
            }
        }
    }

    public void replaceSymbol(String symbol, List<Zone> zones, double atr) {
        synchronized (lock) {
            zonesByKey.values().removeIf(zone -> zone.symbol().equals(symbol));
            for (Zone zone : zones) {
                PersistedZone persisted = toPersisted(symbol, zone);
                PersistedZone existing = zonesByKey.get(persisted.key());
                if (existing == null || existing.touches().size() < persisted.touches().size()) {
                    zonesByKey.put(persisted.key(), persisted);
                }
            }
            if (Double.isFinite(atr) && atr > 0.0) {
                atrBySymbol.put(symbol, atr);
            }
            stagedGeneration++;
        }
    }

    public RestoredZones load(String symbol) {
        synchronized (lock) {
            List<ZoneSeed> seeds = zonesByKey.values().stream()
                    .filter(zone -> zone.symbol().equals(symbol))
                    .sorted(Comparator.comparingDouble(PersistedZone::priceCenter))
                    .map(this::toSeed)
                    .toList();
            return new RestoredZones(seeds, atrBySymbol.getOrDefault(symbol, Double.NaN));
        }
    }

    /**
     * Writes staged state if anything changed since the last successful flush.
     *
     * @return whether a file was written
     * @throws PersistenceException when writing fails; the staged state stays dirty
     */
    public boolean flush() {
        TouchHistoryDocument document;
        long generation;
        Path target;
        synchronized (lock) {
            if (path == null) {
                throw new IllegalStateException("Touch history store is not open");
            }
            if (stagedGeneration == flushedGeneration) {
                return false;
            }
            generation = stagedGeneration;
            target = path;
            document = new TouchHistoryDocument(
                    TouchHistoryDocument.CURRENT_FORMAT,
                    System.currentTimeMillis(),
                    atrBySymbol,
                    new ArrayList<>(zonesByKey.values())
            );
        }

        write(target, document);

        synchronized (lock) {
            flushedGeneration = Math.max(flushedGeneration, generation);
        }
        return true;
    }

    public boolean isDirty() {
        synchronized (lock) {
            return stagedGeneration != flushedGeneration;
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed || path == null) {
                return;
            }
            closed = true;
        }
        flush();
        log.info("event=touch_history_close path={}", path);
    }

    long priceBucket(double price) {
        return Math.round(Math.log(price) / Math.log1p(priceBucketPct));
    }

    private void write(Path target, TouchHistoryDocument document) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to write touch history to " + target, e);
        }
    }

    private PersistedZone toPersisted(String symbol, Zone zone) {
        return new PersistedZone(
                symbol,
                zone.primaryTimeframe(),
                priceBucket(zone.priceCenter()),
                zone.priceCenter(),
                zone.mergeRadius(),
                zone.tier(),
                zone.sourceWeight(),
                zone.confluenceCount(),
                zone.touches().stream().map(PersistedTouch::from).toList()
        );
    }

    private ZoneSeed toSeed(PersistedZone zone) {
        return new ZoneSeed(
                zone.priceCenter(),
                zone.mergeRadius(),
                zone.tier(),
                zone.timeframe(),
                zone.totalWeight(),
                zone.confluenceCount(),
                zone.touches().stream().map(PersistedTouch::toTouchRecord).toList()
        );
    }

    public record RestoredZones(List<ZoneSeed> seeds, double atr) {
    }
}
