package com.earlywarning.analyzer.history;

import com.earlywarning.analyzer.config.HistoryConfig;
import com.earlywarning.analyzer.engine.ThreatLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Bounded in-memory scan history.
 *
 * <p>
 * Keeps at most {@code analyzer.history.max-records} records; the oldest are
 * evicted first. Contents do not survive a restart. Writes are serialized so
 * the bound holds under concurrent saves; reads are lock-free.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class InMemoryScanRecordStore implements ScanRecordStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScanRecordStore.class);

    private final int maxRecords;

    /** Insertion order, newest at the head. */
    private final ConcurrentLinkedDeque<String> order = new ConcurrentLinkedDeque<>();
    private final Map<String, ScanRecord> records = new ConcurrentHashMap<>();

    public InMemoryScanRecordStore(HistoryConfig config) {
        this.maxRecords = config.getMaxRecords();
    }

    @Override
    public synchronized ScanRecord save(ScanRecord record) {
        records.put(record.id(), record);
        order.addFirst(record.id());
        evictOverflow();
        return record;
    }

    private void evictOverflow() {
        while (records.size() > maxRecords) {
            String oldest = order.pollLast();
            if (oldest == null) {
                break;
            }
            if (records.remove(oldest) != null) {
                log.debug("Evicted scan {} from history", oldest);
            }
        }
    }

    @Override
    public List<ScanRecord> recent(int limit) {
        List<ScanRecord> result = new ArrayList<>(Math.min(limit, records.size()));
        Iterator<String> ids = order.iterator();
        while (ids.hasNext() && result.size() < limit) {
            ScanRecord record = records.get(ids.next());
            if (record != null) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public synchronized boolean delete(String id) {
        boolean removed = records.remove(id) != null;
        if (removed) {
            order.remove(id);
        }
        return removed;
    }

    @Override
    public ScanSummary summary() {
        Map<ThreatLevel, Long> byLevel = new EnumMap<>(ThreatLevel.class);
        SortedMap<LocalDate, Long> byDay = new TreeMap<>();
        long total = 0;

        for (ScanRecord record : records.values()) {
            total++;
            byLevel.merge(record.verdict().threatLevel(), 1L, Long::sum);
            byDay.merge(LocalDate.ofInstant(record.createdAt(), ZoneOffset.UTC), 1L, Long::sum);
        }

        return new ScanSummary(
                total,
                byLevel.getOrDefault(ThreatLevel.SAFE, 0L),
                byLevel.getOrDefault(ThreatLevel.SUSPICIOUS, 0L),
                byLevel.getOrDefault(ThreatLevel.HIGH_RISK, 0L),
                byDay);
    }

    @Override
    public int size() {
        return records.size();
    }
}
