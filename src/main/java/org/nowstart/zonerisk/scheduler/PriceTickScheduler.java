package org.nowstart.zonerisk.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.service.PriceTickService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PriceTickScheduler {

    private final ZoneRiskProperties properties;
    private final PriceTickService priceTickService;

    @Scheduled(fixedDelayString = "${zonerisk.evaluation.tick-interval:10s}")
    public void run() {
        if (!properties.evaluation().tickPollingEnabled()) {
            return;
        }
        priceTickService.pollOnce();
    }
}
