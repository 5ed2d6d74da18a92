package com.coa.model;

import java.util.Set;

/**
 * Mission summary fields of a situation.
 *
 * @param missionId     Mission identifier
 * @param missionType   Mission type (e.g. "방어", "Defense")
 * @param priority      Mission priority 1-10
 * @param objectiveTags Objective tags matched against COA purpose tags
 */
public record MissionProfile(
        String missionId,
        String missionType,
        int priority,
        Set<String> objectiveTags
) {
    public MissionProfile {
        objectiveTags = objectiveTags == null ? Set.of() : Set.copyOf(objectiveTags);
    }
}
