package com.example.h3csv.geo;

import com.uber.h3core.H3Core;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * {@link IndexGenerator} backed by Uber's H3 library. Produces the canonical
 * lower-case hexadecimal cell address, e.g. {@code 882a100d25fffff}.
 *
 * <p>H3Core is thread-safe, one instance can serve any number of jobs.</p>
 */
@Slf4j
public class H3IndexGenerator implements IndexGenerator {

    private final H3Core h3;

    public H3IndexGenerator(H3Core h3) {
        this.h3 = h3;
    }

    /**
     * Loads the native H3 library.
     */
    public static H3IndexGenerator create() throws IOException {
        H3Core core = H3Core.newInstance();
        log.debug("Loaded H3 native library");
        return new H3IndexGenerator(core);
    }

    @Override
    public String generate(double latitude, double longitude, int resolution) throws IndexGenerationException {
        if (!H3Resolution.isValidLevel(resolution)) {
            throw new IndexGenerationException("H3 resolution " + resolution + " is out of valid range");
        }
        try {
            return h3.latLngToCellAddress(latitude, longitude, resolution);
        } catch (RuntimeException e) {
            throw new IndexGenerationException("failed to generate H3 index for ("
                    + latitude + ", " + longitude + ") at resolution " + resolution + ": " + e.getMessage(), e);
        }
    }
}
