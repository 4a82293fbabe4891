package uk.gegc.dolos.features.revision.infra;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * W3CDTF timestamps in UTC at second precision, as used by {@code w:date} and {@code dcterms:*}.
 */
public final class RevisionDates {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private RevisionDates() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String format(Instant instant) {
        return FORMAT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
