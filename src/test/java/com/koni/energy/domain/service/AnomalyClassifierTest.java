package com.koni.energy.domain.service;

import com.koni.energy.domain.exception.ClassificationException;
import com.koni.energy.domain.model.AnomalyThresholds;
import com.koni.energy.domain.model.Classification;
import com.koni.energy.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@UnitTest
class AnomalyClassifierTest {

    private final AnomalyClassifier classifier = new AnomalyClassifier(AnomalyThresholds.defaults());

    @Test
    void shouldFlagNegativeNetEnergyAsAnomaly() {
        // When
        Classification classification = classifier.classify(new BigDecimal("10"), new BigDecimal("15"));

        // Then
        assertThat(classification.getNetEnergyKwh()).isEqualByComparingTo("-5");
        assertThat(classification.isAnomaly()).isTrue();
        assertThat(classification.getReasons()).containsExactly("net energy -5 kWh below floor 0 kWh");
    }

    @Test
    void shouldNotFlagBalancedReading() {
        Classification classification = classifier.classify(new BigDecimal("7.5"), new BigDecimal("7.5"));

        assertThat(classification.getNetEnergyKwh()).isEqualByComparingTo("0");
        assertThat(classification.isAnomaly()).isFalse();
        assertThat(classification.getReasons()).isEmpty();
        assertThat(classification.reasonText()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "12.25, 2.5, 9.75",
            "0, 0, 0",
            "0.001, 0.0005, 0.0005",
            "9999.999, 0, 9999.999"
    })
    void shouldComputeNetAsGeneratedMinusConsumed(String generated, String consumed, String expectedNet) {
        Classification classification = classifier.classify(new BigDecimal(generated), new BigDecimal(consumed));

        assertThat(classification.getNetEnergyKwh()).isEqualByComparingTo(expectedNet);
        assertThat(classification.isAnomaly()).isFalse();
    }

    @Test
    void shouldFlagGeneratedValueAtCeiling() {
        Classification classification = classifier.classify(new BigDecimal("10000"), new BigDecimal("1"));

        assertThat(classification.isAnomaly()).isTrue();
        assertThat(classification.getReasons())
                .containsExactly("energy generated 10000 kWh at or above ceiling 10000 kWh");
    }

    @Test
    void shouldFlagConsumedValueAboveCeilingTogetherWithNegativeNet() {
        Classification classification = classifier.classify(new BigDecimal("5"), new BigDecimal("12000"));

        assertThat(classification.isAnomaly()).isTrue();
        assertThat(classification.getReasons()).hasSize(2);
        assertThat(classification.reasonText())
                .contains("below floor")
                .contains("energy consumed 12000 kWh at or above ceiling");
    }

    @Test
    void shouldHonourConfiguredThresholds() {
        // Given
        AnomalyClassifier strict = new AnomalyClassifier(
                new AnomalyThresholds(new BigDecimal("2"), new BigDecimal("50")));

        // Then
        assertThat(strict.classify(new BigDecimal("3"), new BigDecimal("2")).isAnomaly()).isTrue();
        assertThat(strict.classify(new BigDecimal("4"), new BigDecimal("2")).isAnomaly()).isFalse();
        assertThat(strict.classify(new BigDecimal("50"), new BigDecimal("10")).isAnomaly()).isTrue();
    }

    @Test
    void shouldRejectNegativeInputs() {
        assertThatThrownBy(() -> classifier.classify(new BigDecimal("-1"), BigDecimal.ONE))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("energy generated is negative");
    }

    @Test
    void shouldRejectMissingInputs() {
        assertThatThrownBy(() -> classifier.classify(BigDecimal.ONE, null))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("energy consumed is missing");
    }

    @Test
    void shouldRejectNonPositiveCeiling() {
        assertThatThrownBy(() -> new AnomalyThresholds(BigDecimal.ZERO, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
