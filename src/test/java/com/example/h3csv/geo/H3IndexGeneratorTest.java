package com.example.h3csv.geo;

import com.uber.h3core.H3Core;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class H3IndexGeneratorTest {

    private static H3Core h3;
    private static H3IndexGenerator generator;

    @BeforeAll
    static void loadLibrary() throws IOException {
        h3 = H3Core.newInstance();
        generator = new H3IndexGenerator(h3);
    }

    @Test
    void producesValidCellAddressAtRequestedResolution() throws Exception {
        String address = generator.generate(40.7128, -74.0060, 8);

        assertThat(address).matches("[0-9a-f]{15}");
        assertThat(h3.isValidCell(address)).isTrue();
        assertThat(h3.getResolution(address)).isEqualTo(8);
    }

    @Test
    void matchesTheLibraryCellId() throws Exception {
        long cell = h3.latLngToCell(41.85, -87.65, 6);

        assertThat(generator.generate(41.85, -87.65, 6)).isEqualTo(h3.h3ToString(cell));
    }

    @Test
    void isDeterministic() throws Exception {
        String first = generator.generate(51.5074, -0.1278, 10);
        String second = generator.generate(51.5074, -0.1278, 10);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void coarserResolutionGivesParentCell() throws Exception {
        String fine = generator.generate(48.8566, 2.3522, 9);
        String coarse = generator.generate(48.8566, 2.3522, 5);

        assertThat(h3.cellToParentAddress(fine, 5)).isEqualTo(coarse);
    }

    @Test
    void worksAtDomainBoundaries() throws Exception {
        assertThat(generator.generate(90, 180, 0)).isNotEmpty();
        assertThat(generator.generate(-90, -180, 15)).isNotEmpty();
    }

    @Test
    void rejectsResolutionOutsideRange() {
        assertThatThrownBy(() -> generator.generate(0, 0, 16)).isInstanceOf(IndexGenerationException.class);
        assertThatThrownBy(() -> generator.validateResolution(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.validateResolution(16)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptsFullResolutionRangeAtSetup() {
        for (int r = H3Resolution.MIN_LEVEL; r <= H3Resolution.MAX_LEVEL; r++) {
            generator.validateResolution(r);
        }
    }
}
