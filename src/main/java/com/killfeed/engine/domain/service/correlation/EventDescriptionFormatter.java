package com.killfeed.engine.domain.service.correlation;

import com.killfeed.engine.domain.model.DeathType;
import com.killfeed.engine.domain.service.entity.EntityNameResolver;
import com.killfeed.engine.domain.service.entity.ResolvedEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class EventDescriptionFormatter {

    static final String ENVIRONMENT = "Environment";
    static final String UNKNOWN = "unknown";
    static final String ON_FOOT = "Player";

    private final EntityNameResolver entityNameResolver;

    public String format(List<String> killers, List<String> victims, String vehicleModel, DeathType deathType) {
        boolean placeholderVictim = isPlaceholderVictim(victims, vehicleModel);
        String craftName = vehicleModel == null || vehicleModel.isBlank() || ON_FOOT.equals(vehicleModel)
                ? ""
                : entityNameResolver.resolve(vehicleModel).displayName();

        String victimName;
        if (placeholderVictim) {
            victimName = craftName;
        } else if (victims.isEmpty()) {
            victimName = "Unknown";
        } else {
            victimName = victims.stream().map(this::displayName).collect(Collectors.joining(" + "));
        }

        List<String> validKillers = killers.stream()
                .filter(k -> k != null && !k.isBlank() && !UNKNOWN.equalsIgnoreCase(k) && !ENVIRONMENT.equals(k))
                .toList();
        String killerName;
        if (!validKillers.isEmpty()) {
            killerName = validKillers.stream().map(this::displayName).collect(Collectors.joining(" + "));
        } else {
            killerName = killers.contains(ENVIRONMENT) ? ENVIRONMENT : "Unknown";
        }

        String inCraft = craftName.isEmpty() ? "" : " (" + craftName + ")";
        String ownedCraft = craftName.isEmpty() ? "" : "'s " + craftName;

        DeathType type = deathType == null ? DeathType.UNKNOWN : deathType;
        return switch (type) {
            case SUFFOCATION -> victimName + " suffocated";
            case BLEED_OUT -> victimName + " bled out";
            case CRASH -> victimName + inCraft + " crashed";
            case COLLISION -> {
                if (validKillers.isEmpty()) {
                    yield "A collision occurred involving " + victimName + inCraft;
                }
                yield placeholderVictim
                        ? killerName + "'s vessel collided with " + victimName
                        : killerName + " collided with " + victimName + inCraft;
            }
            case SOFT -> placeholderVictim
                    ? killerName + " disabled " + victimName
                    : killerName + " disabled " + victimName + ownedCraft;
            case HARD, COMBAT -> placeholderVictim
                    ? killerName + " destroyed " + victimName
                    : killerName + " destroyed " + victimName + ownedCraft;
            case UNKNOWN -> killers.contains(ENVIRONMENT)
                    ? victimName + " succumbed to environmental factors"
                    : killerName + " defeated " + victimName;
        };
    }

    public static boolean isPlaceholderVictim(List<String> victims, String vehicleModel) {
        return victims.size() == 1 && vehicleModel != null && victims.get(0).equals(vehicleModel);
    }

    private String displayName(String name) {
        if (ENVIRONMENT.equals(name) || UNKNOWN.equalsIgnoreCase(name)) {
            return name;
        }
        ResolvedEntity resolved = entityNameResolver.resolve(name);
        return resolved.isDefined() || resolved.npc() ? resolved.displayName() : name;
    }
}
