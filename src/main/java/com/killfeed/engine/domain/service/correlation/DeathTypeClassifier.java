package com.killfeed.engine.domain.service.correlation;

import com.killfeed.engine.domain.model.DeathType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class DeathTypeClassifier {

    private final CorrelationProperties properties;

    public DeathType classify(int level, String damageType, String causer, String driver) {
        String damage = damageType == null ? "" : damageType.toLowerCase(Locale.ROOT);
        boolean selfInflicted = isSelfInflicted(causer, driver);

        if (damage.equals("collision") || damage.equals("crash")) {
            return selfInflicted ? DeathType.CRASH : DeathType.COLLISION;
        }
        if (damage.equals("bleedout")) {
            return DeathType.BLEED_OUT;
        }
        if (damage.equals("suffocation") || damage.equals("suffocationdamage")) {
            return DeathType.SUFFOCATION;
        }
        if (level >= 2) {
            return DeathType.HARD;
        }
        if (level == 1) {
            return DeathType.SOFT;
        }
        if ("Environment".equalsIgnoreCase(causer)) {
            return DeathType.UNKNOWN;
        }
        if (selfInflicted) {
            return properties.getSelfInflictedPolicy().deathType();
        }
        return DeathType.COMBAT;
    }

    static boolean isSelfInflicted(String causer, String driver) {
        if (causer == null || causer.isBlank() || "unknown".equalsIgnoreCase(causer)) {
            return true;
        }
        return causer.equalsIgnoreCase(driver);
    }
}
