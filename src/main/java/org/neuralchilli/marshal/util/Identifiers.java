package org.neuralchilli.marshal.util;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Run and span identifier formats.
 *
 * <pre>
 * run-20250114T093015Z-3fa9c1
 * run-20250114T093015Z-3fa9c1.0007.ingest
 * </pre>
 */
public final class Identifiers {

    private static final DateTimeFormatter RUN_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private static final Pattern RUN_ID = Pattern.compile("^run-\\d{8}T\\d{6}Z-[0-9a-f]{6}$");

    private Identifiers() {
    }

    public static String newRunId(Clock clock) {
        int suffix = ThreadLocalRandom.current().nextInt(1 << 24);
        return "run-" + RUN_TIMESTAMP.format(clock.instant()) + "-" + String.format("%06x", suffix);
    }

    public static String newRunId() {
        return newRunId(Clock.systemUTC());
    }

    public static boolean isRunId(String value) {
        return value != null && RUN_ID.matcher(value).matches();
    }

    /**
     * Span id for one unit of work inside a run.
     *
     * @param sequence    position within the run, 1-based
     * @param serviceCode short name of the collaborator doing the work
     */
    public static String spanId(String runId, int sequence, String serviceCode) {
        if (sequence < 1 || sequence > 9999) {
            throw new IllegalArgumentException("Span sequence must be in [1, 9999], got: " + sequence);
        }
        return String.format("%s.%04d.%s", runId, sequence, serviceCode);
    }
}
