package org.nowstart.zonerisk.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.exception.PersistenceException;
import org.nowstart.zonerisk.repository.TouchHistoryStore;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TouchHistoryPersistenceService {

    private final TouchHistoryStore touchHistoryStore;

    public void stage(ZoneSnapshot snapshot) {
        touchHistoryStore.replaceSymbol(snapshot.symbol(), snapshot.zones(), snapshot.atr());
    }

    public TouchHistoryStore.RestoredZones restore(String symbol) {
        return touchHistoryStore.load(symbol);
    }

    /**
     * Writes staged history. A failed write is logged and retried on the next call.
     */
    public boolean flush() {
        try {
            boolean written = touchHistoryStore.flush();
            if (written) {
                log.debug("event=touch_history_flush status=written");
            }
            return written;
        } catch (PersistenceException e) {
            log.warn("event=touch_history_flush_failed code={} reason={}", e.getCode(), e.getMessage(), e);
            return false;
        }
    }
}
