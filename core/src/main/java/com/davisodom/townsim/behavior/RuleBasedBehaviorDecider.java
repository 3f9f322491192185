package com.davisodom.townsim.behavior;

import com.davisodom.townsim.action.FacilityActionMapping;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.model.*;
import com.davisodom.townsim.needs.NeedDecayModel;

import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Decider used when no external strategy is plugged in. Only the occasional rest is random.
 *
 * Order of rules: an urgent need (below {@code urgentThreshold}, same priority as interrupts),
 * then the active schedule entry, then an occasional rest, else idle.
 */
public class RuleBasedBehaviorDecider implements BehaviorDecider {

    private static final Map<String, ActionId> ACTIVITY_KEYWORDS = new LinkedHashMap<>();

    static {
        ACTIVITY_KEYWORDS.put("breakfast", ActionId.EAT);
        ACTIVITY_KEYWORDS.put("lunch", ActionId.EAT);
        ACTIVITY_KEYWORDS.put("dinner", ActionId.EAT);
        ACTIVITY_KEYWORDS.put("meal", ActionId.EAT);
        ACTIVITY_KEYWORDS.put("bed", ActionId.SLEEP);
        ACTIVITY_KEYWORDS.put("bath", ActionId.BATHE);
        ACTIVITY_KEYWORDS.put("shower", ActionId.BATHE);
        ACTIVITY_KEYWORDS.put("break", ActionId.REST);
        ACTIVITY_KEYWORDS.put("relax", ActionId.REST);
        ACTIVITY_KEYWORDS.put("chat", ActionId.TALK);
    }

    private final Random random;
    private final SimulationConfig.Behavior config;
    private final FacilityActionMapping mapping;

    public RuleBasedBehaviorDecider(Random random, SimulationConfig.Behavior config, FacilityActionMapping mapping) {
        this.random = random;
        this.config = config;
        this.mapping = mapping;
    }

    @Override
    public CompletableFuture<BehaviorDecision> decide(BehaviorContext context) {
        return CompletableFuture.completedFuture(decideNow(context));
    }

    @Override
    public CompletableFuture<BehaviorDecision> decideInterruptFacility(ActionId forcedAction, BehaviorContext context) {
        BehaviorContext.FacilitySummary facility = pickFacility(context, forcedAction);
        if (facility == null) {
            return CompletableFuture.completedFuture(
                    BehaviorDecision.idle("no facility for " + forcedAction.id()));
        }
        return CompletableFuture.completedFuture(BehaviorDecision.action(forcedAction, facility.id(), null,
                "interrupt: " + forcedAction.id() + " at " + facility.label()));
    }

    BehaviorDecision decideNow(BehaviorContext context) {
        for (NeedType need : NeedDecayModel.INTERRUPT_PRIORITY) {
            if (context.needs().get(need) < config.urgentThreshold) {
                ActionId action = BehaviorOrchestrator.forcedActionFor(need);
                BehaviorContext.FacilitySummary facility = pickFacility(context, action);
                if (facility != null) {
                    return BehaviorDecision.action(action, facility.id(), null,
                            String.format("%s is low (%.0f)", need.name().toLowerCase(Locale.ROOT), context.needs().get(need)));
                }
            }
        }

        ScheduleEntry entry = context.schedule() != null ? context.schedule().activeEntry(context.time()) : null;
        if (entry != null) {
            BehaviorDecision scheduled = followSchedule(context, entry);
            if (scheduled != null) {
                return scheduled;
            }
        }

        if (random.nextDouble() < config.restProbability) {
            BehaviorContext.FacilitySummary facility = pickFacility(context, ActionId.REST);
            if (facility != null) {
                return BehaviorDecision.action(ActionId.REST, facility.id(), null, "taking a break");
            }
        }
        return BehaviorDecision.idle("nothing to do");
    }

    private BehaviorDecision followSchedule(BehaviorContext context, ScheduleEntry entry) {
        ActionId action = activityToAction(entry.activity());
        String reason = "schedule: " + entry.activity();
        if (action == ActionId.TALK) {
            for (BehaviorContext.NpcSummary npc : context.nearbyNpcs()) {
                if (!npc.inConversation()) {
                    return BehaviorDecision.talk(npc.id(), reason);
                }
            }
            return null;
        }
        if (action != null) {
            BehaviorContext.FacilitySummary facility = action == ActionId.WORK && context.employment() != null
                    ? findFacility(context, context.employment().workplaceFacilityId())
                    : pickFacility(context, action, entry.location());
            if (facility != null) {
                return BehaviorDecision.action(action, facility.id(), null, reason);
            }
        }
        // A schedule that names another map is still worth walking to
        if (entry.location() != null && !entry.location().equals(context.currentMapId())) {
            for (BehaviorContext.MapSummary map : context.nearbyMaps()) {
                if (map.id().equals(entry.location())) {
                    return BehaviorDecision.move(map.id(), null, reason);
                }
            }
        }
        return null;
    }

    static ActionId activityToAction(String activity) {
        if (activity == null) {
            return null;
        }
        String normalized = activity.trim().toLowerCase(Locale.ROOT);
        ActionId direct = ActionId.fromId(normalized);
        if (direct != null && direct != ActionId.THINKING) {
            return direct;
        }
        for (ActionId id : ActionId.values()) {
            if (id != ActionId.THINKING && normalized.contains(id.id())) {
                return id;
            }
        }
        for (Map.Entry<String, ActionId> keyword : ACTIVITY_KEYWORDS.entrySet()) {
            if (normalized.contains(keyword.getKey())) {
                return keyword.getValue();
            }
        }
        return null;
    }

    BehaviorContext.FacilitySummary pickFacility(BehaviorContext context, ActionId action) {
        return pickFacility(context, action, null);
    }

    /**
     * Closest usable facility for the action: current map first, then by hop distance.
     * A preferred location (facility id or map id) wins among usable candidates.
     */
    private BehaviorContext.FacilitySummary pickFacility(BehaviorContext context, ActionId action, String preferred) {
        Set<FacilityTag> tags = mapping.tagsFor(action);
        if (tags.isEmpty()) {
            return null;
        }
        List<BehaviorContext.FacilitySummary> candidates = new ArrayList<>(context.currentMapFacilities());
        List<BehaviorContext.FacilitySummary> others = new ArrayList<>(context.nearbyFacilities());
        others.sort(Comparator.comparingInt(BehaviorContext.FacilitySummary::hops));
        candidates.addAll(others);

        BehaviorContext.FacilitySummary first = null;
        for (BehaviorContext.FacilitySummary facility : candidates) {
            if (!usable(context, facility, tags)) {
                continue;
            }
            if (preferred != null && (preferred.equals(facility.id()) || preferred.equals(facility.mapId()))) {
                return facility;
            }
            if (first == null) {
                first = facility;
            }
        }
        return first;
    }

    private BehaviorContext.FacilitySummary findFacility(BehaviorContext context, String facilityId) {
        for (BehaviorContext.FacilitySummary facility : context.currentMapFacilities()) {
            if (facility.id().equals(facilityId)) {
                return facility;
            }
        }
        for (BehaviorContext.FacilitySummary facility : context.nearbyFacilities()) {
            if (facility.id().equals(facilityId)) {
                return facility;
            }
        }
        return null;
    }

    private static boolean usable(BehaviorContext context, BehaviorContext.FacilitySummary facility, Set<FacilityTag> tags) {
        boolean tagged = false;
        for (FacilityTag tag : facility.tags()) {
            if (tags.contains(tag)) {
                tagged = true;
                break;
            }
        }
        return tagged
                && (facility.owner() == null || facility.owner().equals(context.agentId()))
                && facility.cost() <= context.money();
    }
}
