package com.killfeed.engine.domain.service.store;

import com.killfeed.engine.domain.model.KillEvent;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public final class EventFingerprint {

    private EventFingerprint() {
    }

    public static String of(KillEvent event) {
        String minute = Instant.ofEpochMilli(event.getTimestamp()).truncatedTo(ChronoUnit.MINUTES).toString();
        String vehicle = firstNonBlank(event.getVehicleModel(), event.getVehicleType());
        String deathType = event.getDeathType() != null ? event.getDeathType().getLabel() : "";
        return String.join(":",
                sortedJoin(event.getKillers()),
                sortedJoin(event.getVictims()),
                minute,
                nullToEmpty(event.getLocation()),
                vehicle,
                deathType);
    }

    public static String searchText(KillEvent event, int maxLength) {
        StringBuilder sb = new StringBuilder();
        append(sb, event.getEventDescription());
        event.getKillers().forEach(name -> append(sb, name));
        event.getVictims().forEach(name -> append(sb, name));
        append(sb, event.getLocation());
        if (event.getLocationInfo() != null) {
            append(sb, event.getLocationInfo().describe());
        }
        append(sb, event.getWeapon());
        append(sb, event.getVehicleType());
        append(sb, event.getVehicleModel());
        append(sb, event.getDamageType());

        String text = sb.toString().toLowerCase(Locale.ROOT).trim();
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }

    private static String sortedJoin(List<String> names) {
        return names.stream().sorted().collect(Collectors.joining("|"));
    }

    private static void append(StringBuilder sb, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(value).append(' ');
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) return first;
        return nullToEmpty(second);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
