package org.nowstart.zonerisk.zone;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import lombok.Getter;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.nowstart.zonerisk.zone.core.TouchRecord;
import org.nowstart.zonerisk.zone.core.ZoneCluster;
import org.nowstart.zonerisk.zone.core.ZoneSeed;

/**
 * Mutable zone owned by a {@link ZoneBook}. Not thread-safe.
 */
@Getter
class TrackedZone {

    private final long id;
    private double priceCenter;
    private double mergeRadius;
    private List<RawLevel> members;
    private Timeframe primaryTimeframe;
    private ZoneTier tier;
    private int confluenceCount;
    private double totalWeight;
    private int missedCycles;
    private final Deque<TouchRecord> touches = new ArrayDeque<>();

    private boolean inContact;
    private PendingTouch pendingTouch;

    TrackedZone(long id, ZoneCluster cluster) {
        this.id = id;
        updateFrom(cluster);
    }

    TrackedZone(long id, ZoneSeed seed, int historyWindow) {
        this.id = id;
        this.priceCenter = seed.priceCenter();
        this.mergeRadius = seed.mergeRadius();
        this.members = List.of();
        this.primaryTimeframe = seed.primaryTimeframe();
        this.tier = seed.tier();
        this.confluenceCount = Math.max(1, seed.confluenceCount());
        this.totalWeight = Math.max(0.0, seed.totalWeight());
        seed.touches().forEach(touch -> appendTouch(touch, historyWindow));
    }

    void updateFrom(ZoneCluster cluster) {
        this.priceCenter = cluster.priceCenter();
        this.mergeRadius = cluster.mergeRadius();
        this.members = cluster.members();
        this.primaryTimeframe = cluster.primaryTimeframe();
        this.tier = cluster.tier();
        this.confluenceCount = cluster.confluenceCount();
        this.totalWeight = cluster.totalWeight();
        this.missedCycles = 0;
    }

    int markMissed() {
        return ++missedCycles;
    }

    void appendTouch(TouchRecord touch, int historyWindow) {
        touches.addLast(touch);
        while (touches.size() > historyWindow) {
            touches.removeFirst();
        }
    }

    List<TouchRecord> touchHistory() {
        return List.copyOf(touches);
    }

    void setInContact(boolean inContact) {
        this.inContact = inContact;
    }

    void setPendingTouch(PendingTouch pendingTouch) {
        this.pendingTouch = pendingTouch;
    }
}
