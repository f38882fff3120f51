package com.killfeed.engine.domain.service.session;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LogTimestamps {

    private static final Pattern LEADING = Pattern.compile("^\\s*<(\\d{4}-\\d{2}-\\d{2}T[^>]+)>");

    private LogTimestamps() {
    }

    public static long parse(String isoInstant) {
        return Instant.parse(isoInstant.trim()).toEpochMilli();
    }

    public static long leadingOrDefault(String line, long fallback) {
        Matcher m = LEADING.matcher(line);
        return m.find() ? parse(m.group(1)) : fallback;
    }
}
