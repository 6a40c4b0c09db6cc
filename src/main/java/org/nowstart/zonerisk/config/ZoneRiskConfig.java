package org.nowstart.zonerisk.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.exception.PersistenceException;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.repository.TouchHistoryStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ZoneRiskConfig {

    @Bean(destroyMethod = "close")
    public TouchHistoryStore touchHistoryStore(ObjectMapper objectMapper, ZoneRiskProperties zoneRiskProperties) {
        ZoneRiskProperties.Persistence persistence = zoneRiskProperties.persistence();
        Path path = Path.of(persistence.path());
        TouchHistoryStore store = new TouchHistoryStore(objectMapper, persistence.priceBucketPct().doubleValue());
        try {
            return store.open(path);
        } catch (PersistenceException e) {
            Path quarantined = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
            log.warn("event=touch_history_unreadable path={} quarantined={} reason={}", path, quarantined, e.getMessage(), e);
            moveAside(path, quarantined);
            return store.open(path);
        }
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService levelSourceExecutor(ZoneRiskProperties zoneRiskProperties) {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(zoneRiskProperties.evaluation().sourceThreads(), runnable -> {
            Thread thread = new Thread(runnable, "level-source-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private void moveAside(Path path, Path quarantined) {
        try {
            Files.move(path, quarantined, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new PersistenceException("Failed to move unreadable touch history aside: " + path, e);
        }
    }
}
