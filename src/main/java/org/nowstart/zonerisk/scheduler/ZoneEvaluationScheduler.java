package org.nowstart.zonerisk.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.service.ZoneEvaluationWorkflowService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ZoneEvaluationScheduler {

    private final ZoneEvaluationWorkflowService zoneEvaluationWorkflowService;

    @Scheduled(
            initialDelayString = "${zonerisk.evaluation.initial-delay:5s}",
            fixedDelayString = "${zonerisk.evaluation.interval:15m}"
    )
    public void run() {
        zoneEvaluationWorkflowService.runOnce();
    }
}
