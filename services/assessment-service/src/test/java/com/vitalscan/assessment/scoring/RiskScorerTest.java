package com.vitalscan.assessment.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.vitalscan.assessment.domain.ParsedVitals;
import com.vitalscan.assessment.domain.RiskScore;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RiskScorerTest {

    private final RiskScorer scorer = new RiskScorer();

    @ParameterizedTest
    @CsvSource({
        "110, 70, 1",
        "119, 79, 1",
        "120, 79, 2",
        "129, 60, 2",
        "130, 70, 3",
        "139, 85, 3",
        "115, 85, 3",
        "125, 89, 3",
        "140, 70, 4",
        "110, 90, 4",
        "180, 120, 4"
    })
    void bloodPressure_firstMatchingBandWins(int systolic, int diastolic, int expected) {
        assertThat(scorer.bloodPressureScore(OptionalInt.of(systolic), OptionalInt.of(diastolic)))
            .isEqualTo(expected);
    }

    @Test
    void bloodPressure_needsBothSides() {
        assertThat(scorer.bloodPressureScore(OptionalInt.of(150), OptionalInt.empty())).isZero();
        assertThat(scorer.bloodPressureScore(OptionalInt.empty(), OptionalInt.of(95))).isZero();
        assertThat(scorer.bloodPressureScore(OptionalInt.empty(), OptionalInt.empty())).isZero();
    }

    @ParameterizedTest
    @CsvSource({
        "98.6, 0",
        "99.5, 0",
        "99.55, 0",
        "99.6, 1",
        "100.9, 1",
        "100.95, 0",
        "101.0, 2",
        "104.2, 2"
    })
    void temperature_bands(double temperature, int expected) {
        assertThat(scorer.temperatureScore(OptionalDouble.of(temperature))).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "0, 1",
        "39, 1",
        "40, 1",
        "65, 1",
        "66, 2",
        "90, 2"
    })
    void age_bands(int age, int expected) {
        assertThat(scorer.ageScore(OptionalInt.of(age))).isEqualTo(expected);
    }

    @Test
    void invalidFieldsContributeNothing() {
        ParsedVitals vitals = new ParsedVitals(
            OptionalInt.empty(), OptionalInt.empty(), OptionalDouble.empty(), OptionalInt.empty());

        RiskScore score = scorer.score(vitals);

        assertThat(score.total()).isZero();
        assertThat(score.isHighRisk()).isFalse();
    }

    @Test
    void highRiskStartsAtFour() {
        RiskScore three = scorer.score(new ParsedVitals(
            OptionalInt.of(130), OptionalInt.of(70), OptionalDouble.of(98.0), OptionalInt.empty()));
        RiskScore four = scorer.score(new ParsedVitals(
            OptionalInt.of(130), OptionalInt.of(70), OptionalDouble.of(98.0), OptionalInt.of(30)));

        assertThat(three.total()).isEqualTo(3);
        assertThat(three.isHighRisk()).isFalse();
        assertThat(four.total()).isEqualTo(4);
        assertThat(four.isHighRisk()).isTrue();
    }

    @Test
    void fever_requiresParsedTemperatureAtThreshold() {
        assertThat(scorer.isFever(OptionalDouble.of(99.6))).isTrue();
        assertThat(scorer.isFever(OptionalDouble.of(99.59))).isFalse();
        assertThat(scorer.isFever(OptionalDouble.empty())).isFalse();
    }
}
