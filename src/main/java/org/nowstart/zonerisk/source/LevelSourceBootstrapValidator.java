package org.nowstart.zonerisk.source;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LevelSourceBootstrapValidator {

    private final LevelSourceRegistry levelSourceRegistry;

    @PostConstruct
    void validate() {
        if (levelSourceRegistry.enabledSources().isEmpty()) {
            throw new IllegalStateException("At least one level source must be enabled");
        }
    }
}
