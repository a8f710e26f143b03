package com.example.h3csv.util;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Turns a user supplied encoding name into a {@link Charset}.
 *
 * <p>Accepts the canonical JDK names, the common IBM code page spellings
 * ({@code IBM1388}, {@code ibm-1388}, {@code cp1388}) and {@value #AUTO}, which
 * sniffs the input file with ICU4J.</p>
 */
@Slf4j
public final class CharsetResolver {

    public static final String AUTO = "auto";

    static final int SNIFF_BYTES = 64 * 1024;
    static final int MIN_CONFIDENCE = 30;

    private CharsetResolver() {}

    public static Charset forInput(String name, Path input) throws IOException {
        if (name != null && AUTO.equalsIgnoreCase(name.trim())) {
            return detect(input);
        }
        return resolve(name);
    }

    public static Charset resolve(String name) {
        if (name == null || name.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        for (String candidate : candidates(name.trim())) {
            if (isSupported(candidate)) {
                Charset cs = Charset.forName(candidate);
                if (!candidate.equals(name.trim())) {
                    log.info("Resolved charset '{}' -> '{}'", name, cs.name());
                }
                return cs;
            }
        }
        log.warn("Failed to resolve charset '{}', falling back to UTF-8", name);
        return StandardCharsets.UTF_8;
    }

    /**
     * Guesses the encoding from the first {@value #SNIFF_BYTES} bytes. Falls back to UTF-8
     * when ICU is not confident or names a charset the JDK lacks.
     */
    public static Charset detect(Path input) throws IOException {
        byte[] sample;
        try (InputStream in = Files.newInputStream(input)) {
            sample = in.readNBytes(SNIFF_BYTES);
        }
        if (sample.length == 0) {
            return StandardCharsets.UTF_8;
        }
        CharsetDetector detector = new CharsetDetector();
        detector.setText(sample);
        CharsetMatch match = detector.detect();
        if (match == null || match.getConfidence() < MIN_CONFIDENCE || !isSupported(match.getName())) {
            log.info("Could not detect encoding of {} with confidence, using UTF-8", input);
            return StandardCharsets.UTF_8;
        }
        log.info("Detected encoding of {}: {} (confidence {})", input, match.getName(), match.getConfidence());
        return Charset.forName(match.getName());
    }

    private static boolean isSupported(String name) {
        try {
            return Charset.isSupported(name);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static List<String> candidates(String name) {
        List<String> list = new ArrayList<>();
        list.add(name);
        String digits = name.replaceAll("\\D+", "");
        // only code-page style names such as IBM1388 get the alias treatment
        boolean codePage = digits.length() >= 3;
        if (codePage) {
            list.add("Cp" + digits);
            list.add("IBM" + digits);
            list.add("ibm-" + digits);
            list.add("x-IBM" + digits);
        }
        String lower = name.toLowerCase(Locale.ROOT);
        Charset.availableCharsets().forEach((k, v) -> {
            String key = k.toLowerCase(Locale.ROOT);
            if (key.equals(lower) || (codePage && key.matches(".*\\D" + digits + "$"))) {
                list.add(k);
            }
        });
        List<String> out = new ArrayList<>();
        for (String s : list) {
            if (!out.contains(s)) {
                out.add(s);
            }
        }
        return out;
    }

    /**
     * Available charsets whose canonical name or one of whose aliases contains {@code filter}.
     */
    public static SortedMap<String, Charset> matching(String filter) {
        SortedMap<String, Charset> all = Charset.availableCharsets();
        if (filter == null || filter.isBlank()) {
            return all;
        }
        String needle = filter.trim().toLowerCase(Locale.ROOT);
        SortedMap<String, Charset> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        all.forEach((k, v) -> {
            boolean hit = k.toLowerCase(Locale.ROOT).contains(needle)
                    || v.aliases().stream().anyMatch(a -> a.toLowerCase(Locale.ROOT).contains(needle));
            if (hit) {
                out.put(k, v);
            }
        });
        return out;
    }
}
