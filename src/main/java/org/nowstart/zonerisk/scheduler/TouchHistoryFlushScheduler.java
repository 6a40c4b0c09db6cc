package org.nowstart.zonerisk.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.service.TouchHistoryPersistenceService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TouchHistoryFlushScheduler {

    private final TouchHistoryPersistenceService touchHistoryPersistenceService;

    @Scheduled(fixedDelayString = "${zonerisk.persistence.flush-interval:10s}")
    public void run() {
        touchHistoryPersistenceService.flush();
    }
}
