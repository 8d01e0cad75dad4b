package org.blocksync.registry.features.basic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Text form of a 5x5 LED image: five rows of {@code #} (on) and {@code .} (off) markers
 * separated by single spaces, rows joined by newlines.
 */
final class LedMatrix {

    static final String FIELD = "LEDS";
    private static final int SIZE = 5;

    private LedMatrix() {
    }

    static String blank() {
        List<String> rows = new ArrayList<>();
        for (int i = 0; i < SIZE; i++) {
            rows.add(row(""));
        }
        return String.join("\n", rows);
    }

    /**
     * Brings a drawn image into canonical form: whitespace and indentation are ignored, short
     * rows and missing rows are padded with dark LEDs.
     *
     * @param drawn The literal's content.
     * @return The canonical image, or empty if it contains anything besides markers or more
     *         than five rows or columns.
     */
    static Optional<String> normalize(String drawn) {
        List<String> rows = new ArrayList<>();
        for (String line : drawn.split("\n")) {
            String markers = line.replaceAll("\\s+", "");
            if (markers.isEmpty()) {
                continue;
            }
            if (markers.length() > SIZE || !markers.matches("[#.]+")) {
                return Optional.empty();
            }
            rows.add(row(markers));
        }
        if (rows.size() > SIZE) {
            return Optional.empty();
        }
        while (rows.size() < SIZE) {
            rows.add(row(""));
        }
        return Optional.of(String.join("\n", rows));
    }

    private static String row(String markers) {
        StringBuilder padded = new StringBuilder(markers);
        while (padded.length() < SIZE) {
            padded.append('.');
        }
        return String.join(" ", padded.toString().split(""));
    }
}
