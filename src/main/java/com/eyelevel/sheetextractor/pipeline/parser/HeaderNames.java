package com.eyelevel.sheetextractor.pipeline.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Makes raw header cells usable as row keys: blanks become {@code column_<n>} and repeated names get a
 * {@code _<n>} suffix.
 */
final class HeaderNames {

    private HeaderNames() {
    }

    static List<String> normalize(final List<String> raw) {
        final List<String> names = new ArrayList<>(raw.size());
        final Set<String> seen = new HashSet<>();
        for (int i = 0; i < raw.size(); i++) {
            final String value = raw.get(i) == null ? "" : raw.get(i).trim();
            final String base = value.isEmpty() ? "column_" + (i + 1) : value;
            String name = base;
            int suffix = 2;
            while (!seen.add(name)) {
                name = base + "_" + suffix++;
            }
            names.add(name);
        }
        return names;
    }
}
