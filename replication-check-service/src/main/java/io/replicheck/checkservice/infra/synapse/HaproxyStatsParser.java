package io.replicheck.checkservice.infra.synapse;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts healthy servers per backend in an HAProxy {@code ;csv} stats page.
 */
final class HaproxyStatsParser {

    static final String HEADER_PREFIX = "# ";

    private static final Set<String> AGGREGATE_ROWS = Set.of("FRONTEND", "BACKEND");

    private HaproxyStatsParser() {
    }

    /**
     * Returns an entry for every wanted backend that has at least one server row, mapped to the
     * number of those rows whose status starts with {@code UP}. Backends with no server rows,
     * including those listed only through their FRONTEND/BACKEND rows, are left out.
     *
     * @throws IllegalStateException if the header is missing or lacks a required column
     */
    static Map<String, Integer> countAvailable(String csv, Collection<String> wanted) {
        List<String> lines = csv.lines().toList();
        int headerIndex = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).startsWith(HEADER_PREFIX)) {
                headerIndex = i;
                break;
            }
        }
        if (headerIndex < 0) {
            throw new IllegalStateException("HAProxy stats output has no '# pxname' header line");
        }
        String[] header = lines.get(headerIndex).substring(HEADER_PREFIX.length()).split(",", -1);
        int pxname = column(header, "pxname");
        int svname = column(header, "svname");
        int status = column(header, "status");

        Set<String> lookup = Set.copyOf(wanted);
        Map<String, Integer> counts = new HashMap<>();
        for (String line : lines.subList(headerIndex + 1, lines.size())) {
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            String[] fields = line.split(",", -1);
            if (fields.length <= Math.max(pxname, Math.max(svname, status))) {
                continue;
            }
            String backend = fields[pxname];
            if (!lookup.contains(backend)) {
                continue;
            }
            if (AGGREGATE_ROWS.contains(fields[svname])) {
                continue;
            }
            counts.merge(backend, fields[status].startsWith("UP") ? 1 : 0, Integer::sum);
        }
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (String backend : wanted) {
            Integer count = counts.get(backend);
            if (count != null) {
                ordered.put(backend, count);
            }
        }
        return ordered;
    }

    private static int column(String[] header, String name) {
        for (int i = 0; i < header.length; i++) {
            if (header[i].trim().equals(name)) {
                return i;
            }
        }
        throw new IllegalStateException("HAProxy stats header has no '" + name + "' column");
    }
}
