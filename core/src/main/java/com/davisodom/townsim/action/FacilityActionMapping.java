package com.davisodom.townsim.action;

import com.davisodom.townsim.model.ActionId;
import com.davisodom.townsim.model.FacilityInfo;
import com.davisodom.townsim.model.FacilityTag;

import java.util.*;

/**
 * Lookup table from facility tags to the abstract action each tag supports.
 * Pure data: built once and handed to whoever needs it.
 */
public class FacilityActionMapping {

    private final Map<FacilityTag, ActionId> tagToAction;

    public FacilityActionMapping(Map<FacilityTag, ActionId> tagToAction) {
        this.tagToAction = Collections.unmodifiableMap(new EnumMap<>(tagToAction));
    }

    public static FacilityActionMapping defaults() {
        Map<FacilityTag, ActionId> table = new EnumMap<>(FacilityTag.class);
        table.put(FacilityTag.BEDROOM, ActionId.SLEEP);
        table.put(FacilityTag.KITCHEN, ActionId.EAT);
        table.put(FacilityTag.RESTAURANT, ActionId.EAT);
        table.put(FacilityTag.BATHROOM, ActionId.BATHE);
        table.put(FacilityTag.HOTSPRING, ActionId.BATHE);
        table.put(FacilityTag.TOILET, ActionId.TOILET);
        table.put(FacilityTag.WORKSPACE, ActionId.WORK);
        table.put(FacilityTag.PUBLIC, ActionId.REST);
        return new FacilityActionMapping(table);
    }

    /**
     * Tags whose facilities support the action; empty for actions that need no facility.
     */
    public Set<FacilityTag> tagsFor(ActionId actionId) {
        Set<FacilityTag> tags = EnumSet.noneOf(FacilityTag.class);
        for (Map.Entry<FacilityTag, ActionId> entry : tagToAction.entrySet()) {
            if (entry.getValue() == actionId) {
                tags.add(entry.getKey());
            }
        }
        return tags;
    }

    public boolean requiresFacility(ActionId actionId) {
        return tagToAction.containsValue(actionId);
    }

    public Set<ActionId> actionsFor(FacilityInfo facility) {
        Set<ActionId> actions = EnumSet.noneOf(ActionId.class);
        if (facility == null) {
            return actions;
        }
        for (FacilityTag tag : facility.tags()) {
            ActionId action = tagToAction.get(tag);
            if (action != null) {
                actions.add(action);
            }
        }
        return actions;
    }

    public boolean supports(FacilityInfo facility, ActionId actionId) {
        return actionsFor(facility).contains(actionId);
    }
}
