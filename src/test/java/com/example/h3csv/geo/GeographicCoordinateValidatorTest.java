package com.example.h3csv.geo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeographicCoordinateValidatorTest {

    private final CoordinateValidator validator = new GeographicCoordinateValidator();

    @ParameterizedTest
    @CsvSource({
            "0, 0",
            "40.7128, -74.0060",
            "90, 180",
            "-90, -180",
            "-90, 180"
    })
    void acceptsCoordinatesInsideTheDomainInclusive(double lat, double lng) {
        assertThatCode(() -> validator.validate(lat, lng)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @CsvSource({
            "91.0, 0.0",
            "-90.0001, 0",
            "0, 180.5",
            "0, -181"
    })
    void rejectsCoordinatesOutsideTheDomain(double lat, double lng) {
        assertThatThrownBy(() -> validator.validate(lat, lng))
                .isInstanceOf(InvalidCoordinateException.class);
    }

    @Test
    void rejectsNaNAndInfinity() {
        assertThatThrownBy(() -> validator.validate(Double.NaN, 0)).isInstanceOf(InvalidCoordinateException.class);
        assertThatThrownBy(() -> validator.validate(0, Double.NaN)).isInstanceOf(InvalidCoordinateException.class);
        assertThatThrownBy(() -> validator.validate(Double.POSITIVE_INFINITY, 0))
                .isInstanceOf(InvalidCoordinateException.class);
    }

    @Test
    void messageNamesTheOffendingAxis() {
        assertThatThrownBy(() -> validator.validate(0, 200))
                .hasMessageContaining("longitude 200.0");
    }
}
