package org.nowstart.zonerisk.source;

import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LevelSourceRegistry {

    private final List<LevelSource> sources;
    private final ZoneRiskProperties properties;
    private Map<String, LevelSource> sourcesByTag = Map.of();

    @PostConstruct
    public void init() {
        Map<String, LevelSource> byTag = new HashMap<>();
        for (LevelSource source : sources) {
            String tag = normalize(source.tag());
            LevelSource previous = byTag.put(tag, source);
            if (previous != null) {
                throw new IllegalStateException("Duplicate level source registered for tag=" + tag);
            }
        }
        sourcesByTag = Map.copyOf(byTag);
    }

    public LevelSource getRequired(String tag) {
        LevelSource source = sourcesByTag.get(normalize(tag));
        if (source == null) {
            throw new IllegalStateException("No level source registered for tag=" + tag);
        }
        return source;
    }

    /**
     * Enabled sources in configuration order.
     */
    public List<LevelSource> enabledSources() {
        return properties.sources().enabled().stream()
                .map(this::getRequired)
                .distinct()
                .toList();
    }

    private String normalize(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("level source tag is required");
        }
        return tag.trim().toLowerCase(Locale.ROOT);
    }
}
