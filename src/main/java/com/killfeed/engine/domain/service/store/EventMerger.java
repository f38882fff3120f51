package com.killfeed.engine.domain.service.store;

import com.killfeed.engine.domain.model.KillEvent;
import com.killfeed.engine.domain.model.ProfileData;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

final class EventMerger {

    private EventMerger() {
    }

    static KillEvent merge(KillEvent existing, KillEvent incoming) {
        boolean incomingWins = completeness(incoming) > completeness(existing);
        KillEvent primary = incomingWins ? incoming : existing;
        KillEvent secondary = incomingWins ? existing : incoming;

        KillEvent merged = primary.copy();
        merged.setId(existing.getId());
        merged.setTimestamp(existing.getTimestamp());
        merged.setKillers(union(existing.getKillers(), incoming.getKillers()));
        merged.setVictims(union(existing.getVictims(), incoming.getVictims()));

        fill(merged, secondary, KillEvent::getVehicleType, KillEvent::setVehicleType);
        fill(merged, secondary, KillEvent::getVehicleModel, KillEvent::setVehicleModel);
        fill(merged, secondary, KillEvent::getVehicleId, KillEvent::setVehicleId);
        fill(merged, secondary, KillEvent::getLocation, KillEvent::setLocation);
        fill(merged, secondary, KillEvent::getLocationInfo, KillEvent::setLocationInfo);
        fill(merged, secondary, KillEvent::getWeapon, KillEvent::setWeapon);
        fill(merged, secondary, KillEvent::getDamageType, KillEvent::setDamageType);
        fill(merged, secondary, KillEvent::getGameMode, KillEvent::setGameMode);
        fill(merged, secondary, KillEvent::getGameVersion, KillEvent::setGameVersion);
        fill(merged, secondary, KillEvent::getCoordinates, KillEvent::setCoordinates);
        fill(merged, secondary, KillEvent::getPlayerShip, KillEvent::setPlayerShip);
        fill(merged, secondary, KillEvent::getPlayerName, KillEvent::setPlayerName);
        fill(merged, secondary, KillEvent::getEventDescription, KillEvent::setEventDescription);
        merged.setVictimProfile(preferEnriched(merged.getVictimProfile(), secondary.getVictimProfile()));
        merged.setAttackerProfile(preferEnriched(merged.getAttackerProfile(), secondary.getAttackerProfile()));

        Set<String> mergedFrom = new LinkedHashSet<>(existing.getMergedFrom());
        mergedFrom.addAll(incoming.getMergedFrom());
        if (!incoming.getId().equals(existing.getId())) {
            mergedFrom.add(incoming.getId());
        }
        merged.setMergedFrom(new ArrayList<>(mergedFrom));
        return merged;
    }

    static KillEvent replace(KillEvent existing, KillEvent incoming) {
        KillEvent replaced = incoming.copy();
        replaced.setVictimProfile(preferEnriched(incoming.getVictimProfile(), existing.getVictimProfile()));
        replaced.setAttackerProfile(preferEnriched(incoming.getAttackerProfile(), existing.getAttackerProfile()));
        Set<String> mergedFrom = new LinkedHashSet<>(existing.getMergedFrom());
        mergedFrom.addAll(incoming.getMergedFrom());
        replaced.setMergedFrom(new ArrayList<>(mergedFrom));
        return replaced;
    }

    static int completeness(KillEvent event) {
        int score = 0;
        if (notBlank(event.getVehicleType())) score++;
        if (notBlank(event.getVehicleModel())) score++;
        if (notBlank(event.getLocation())) score++;
        if (event.getLocationInfo() != null && !event.getLocationInfo().isFallback()) score++;
        if (notBlank(event.getWeapon())) score++;
        if (notBlank(event.getDamageType())) score++;
        if (event.getCoordinates() != null) score++;
        if (notBlank(event.getGameVersion())) score++;
        if (notBlank(event.getEventDescription())) score++;
        if (event.getVictimProfile() != null && !event.getVictimProfile().isDefault()) score++;
        if (event.getAttackerProfile() != null && !event.getAttackerProfile().isDefault()) score++;
        return score;
    }

    private static ProfileData preferEnriched(ProfileData preferred, ProfileData other) {
        if (preferred != null && !preferred.isDefault()) return preferred;
        if (other != null && !other.isDefault()) return other;
        return ProfileData.DEFAULT;
    }

    private static <T> void fill(KillEvent target, KillEvent source,
                                 Function<KillEvent, T> getter, BiConsumer<KillEvent, T> setter) {
        T current = getter.apply(target);
        if (current == null || (current instanceof String s && s.isBlank())) {
            T fallback = getter.apply(source);
            if (fallback != null) setter.accept(target, fallback);
        }
    }

    private static List<String> union(List<String> first, List<String> second) {
        Set<String> names = new LinkedHashSet<>(first);
        names.addAll(second);
        return new ArrayList<>(names);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
