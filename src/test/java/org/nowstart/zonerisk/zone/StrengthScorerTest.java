package org.nowstart.zonerisk.zone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.zonerisk.ZoneRiskPropertiesFixture;
import org.nowstart.zonerisk.data.exception.InsufficientHistoryException;
import org.nowstart.zonerisk.data.type.ZoneTier;
import org.nowstart.zonerisk.zone.core.TouchRecord;
import org.nowstart.zonerisk.zone.core.Zone;

class StrengthScorerTest {

    private final StrengthScorer scorer = new StrengthScorer(ZoneRiskPropertiesFixture.defaults());

    @Test
    void score_withoutTouchesUsesNeutralRejectionAndFlagsLowConfidence() {
        StrengthScorer.ZoneStrength strength = scorer.score(2.0, ZoneTier.INTERMEDIATE, 2, List.of());

        // base 2.0 + touch quality 5/10*3*0.8 + timeframe 1.5 + confluence 0.5
        assertThat(strength.score()).isCloseTo(5.2, within(1e-9));
        assertThat(strength.lowConfidence()).isTrue();
    }

    @Test
    void score_isClampedToMaximum() {
        List<TouchRecord> touches = List.of(touch(10.0), touch(10.0), touch(10.0));

        StrengthScorer.ZoneStrength strength = scorer.score(50.0, ZoneTier.MAJOR, 6, touches);

        assertThat(strength.score()).isEqualTo(StrengthScorer.MAX_SCORE);
        assertThat(strength.baseComponent()).isEqualTo(3.0);
        assertThat(strength.lowConfidence()).isFalse();
    }

    @Test
    void score_staysWithinRangeForDegenerateInputs() {
        List<TouchRecord> touches = new ArrayList<>();
        touches.add(touch(Double.NaN));
        touches.add(touch(-4.0));

        StrengthScorer.ZoneStrength strength = scorer.score(Double.NaN, null, 0, touches);

        assertThat(strength.score()).isBetween(0.0, StrengthScorer.MAX_SCORE);
        assertThat(strength.timeframeComponent()).isEqualTo(ZoneTier.MINOR.timeframeWeight());
    }

    @Test
    void touchCountFactor_peaksForTwoOrThreeTouches() {
        assertThat(scorer.touchCountFactor(1)).isEqualTo(0.8);
        assertThat(scorer.touchCountFactor(3)).isEqualTo(1.0);
        assertThat(scorer.touchCountFactor(5)).isEqualTo(0.9);
        assertThat(scorer.touchCountFactor(9)).isEqualTo(0.7);
    }

    @Test
    void confluenceBonus_growsWithTimeframes() {
        assertThat(scorer.confluenceBonus(1)).isZero();
        assertThat(scorer.confluenceBonus(2)).isEqualTo(0.5);
        assertThat(scorer.confluenceBonus(3)).isEqualTo(1.0);
        assertThat(scorer.confluenceBonus(4)).isEqualTo(1.5);
    }

    @Test
    void requireConfidentHistory_throwsBelowMinimum() {
        assertThatThrownBy(() -> scorer.requireConfidentHistory(List.of(touch(5.0))))
                .isInstanceOf(InsufficientHistoryException.class)
                .hasMessageContaining("1 touches");
    }

    @Test
    void byStrengthThenProximity_breaksTiesByDistance() {
        Zone far = zone(1L, 120.0, 6.0);
        Zone near = zone(2L, 105.0, 6.0);
        Zone strong = zone(3L, 150.0, 8.0);

        List<Zone> sorted = new ArrayList<>(List.of(far, near, strong));
        sorted.sort(StrengthScorer.byStrengthThenProximity(100.0));

        assertThat(sorted).extracting(Zone::id).containsExactly(3L, 2L, 1L);
    }

    private TouchRecord touch(double rejection) {
        return new TouchRecord(Instant.parse("2024-01-01T00:00:00Z"), 100.0, rejection, 1.0);
    }

    private Zone zone(long id, double center, double score) {
        return new Zone(id, center, 1.0, List.of(), ZoneTier.MINOR, null, score, 1, List.of(), false, 0);
    }
}
