package io.rstkit.server.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Parser for quality-weighted header lists such as {@code Accept} and {@code Accept-Encoding}.
 */
final class QualityList {

    private QualityList() {}

    record Preference(String value, double quality) {
        boolean acceptable() {
            return quality > 0;
        }
    }

    /**
     * Parses {@code raw}, most preferred first. Entries with equal weight keep their order;
     * a malformed weight counts as zero.
     */
    static List<Preference> parse(String raw) {
        List<Preference> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",")) {
            String[] params = part.split(";");
            String value = params[0].trim().toLowerCase(Locale.ROOT);
            if (value.isEmpty()) continue;
            double q = 1.0;
            for (int i = 1; i < params.length; i++) {
                String p = params[i].trim();
                if (p.startsWith("q=") || p.startsWith("Q=")) {
                    q = parseQuality(p.substring(2).trim());
                }
            }
            out.add(new Preference(value, q));
        }
        out.sort(Comparator.comparingDouble(Preference::quality).reversed());
        return out;
    }

    private static double parseQuality(String s) {
        try {
            double q = Double.parseDouble(s);
            return (q < 0 || q > 1) ? 0 : q;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
