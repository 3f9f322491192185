package com.davisodom.townsim.action;

import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.core.EventBus;
import com.davisodom.townsim.core.SimulationEvent;
import com.davisodom.townsim.model.*;
import com.davisodom.townsim.world.Npc;
import com.davisodom.townsim.world.SimCharacter;
import com.davisodom.townsim.world.WorldState;

import java.time.Clock;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Config-driven action executor.
 *
 * Fixed actions apply their effects once on completion. Ranged actions expose per-minute rates
 * while running and apply nothing at the end. {@code work} pays the hourly wage on completion,
 * {@code talk} holds both sides in conversation until it ends, and the thinking placeholder
 * never completes on its own.
 */
public class DefaultActionExecutor implements ActionExecutor {

    private static final Logger LOGGER = Logger.getLogger(DefaultActionExecutor.class.getName());

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final WorldState world;
    private final EventBus events;
    private final Map<ActionId, ActionDefinition> definitions;
    private final FacilityActionMapping mapping;
    private final FacilityLocator locator;
    private final Clock clock;

    public DefaultActionExecutor(WorldState world, EventBus events, SimulationConfig config,
                                 FacilityActionMapping mapping, FacilityLocator locator, Clock clock) {
        this.world = world;
        this.events = events;
        this.definitions = new EnumMap<>(ActionId.class);
        if (config.actions != null) {
            this.definitions.putAll(config.actions);
        }
        this.mapping = mapping;
        this.locator = locator;
        this.clock = clock;
    }

    @Override
    public boolean startAction(String agentId, ActionId actionId, String facilityId, String targetNpcId,
                               Integer durationMinutes, String reason) {
        ActionCheck check = canExecuteAction(agentId, actionId, facilityId, targetNpcId);
        if (!check.allowed()) {
            LOGGER.info(String.format("[ACTION] %s cannot start %s: %s",
                    agentId, actionId != null ? actionId.id() : null, check.reason()));
            return false;
        }
        SimCharacter c = world.getCharacter(agentId);
        long now = clock.millis();

        if (actionId == ActionId.THINKING) {
            world.setCurrentAction(agentId, new ActionState(ActionId.THINKING, now, now, null, null, null, reason));
            return true;
        }

        ActionDefinition def = definitions.get(actionId);
        Obstacle facility = resolveFacility(c, facilityId);
        int cost = facility != null && facility.getFacility().cost() > 0 ? facility.getFacility().cost() : def.cost;
        if (cost > 0) {
            world.setMoney(agentId, c.getMoney() - cost);
            LOGGER.info(String.format("[ACTION] %s paid %d for %s", agentId, cost, actionId.id()));
        }

        int minutes = def.resolveDuration(durationMinutes);
        String usedFacilityId = facility != null ? facility.getId() : null;
        String npcId = actionId == ActionId.TALK ? resolveTalkTarget(c, targetNpcId).getId() : null;
        world.setCurrentAction(agentId, new ActionState(actionId, now, now + minutes * MILLIS_PER_MINUTE,
                usedFacilityId, npcId, minutes, reason));
        world.setDisplayEmoji(agentId, def.emoji);
        if (npcId != null) {
            world.setCharacterConversation(agentId, true);
            world.setNpcConversation(npcId, true);
        }

        LOGGER.info(String.format("[ACTION] %s started %s for %d min%s", agentId, actionId.id(), minutes,
                usedFacilityId != null ? " at " + usedFacilityId : ""));
        events.publish(SimulationEvent.actionStarted(agentId, actionId, usedFacilityId != null ? usedFacilityId : npcId));
        return true;
    }

    @Override
    public void tick(long nowMillis) {
        for (SimCharacter c : world.getCharacters()) {
            ActionState action = c.getCurrentAction();
            if (action == null || action.isThinking()) {
                continue;
            }
            if (nowMillis >= action.targetEndTime()) {
                try {
                    complete(c);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.SEVERE, "[ACTION] Completion failed for " + c.getId(), e);
                    abandon(c.getId(), action);
                }
            }
        }
    }

    @Override
    public Map<NeedType, Double> getActivePerMinuteEffects(String agentId) {
        SimCharacter c = world.getCharacter(agentId);
        if (c == null || c.getCurrentAction() == null || c.getCurrentAction().isThinking()) {
            return null;
        }
        ActionDefinition def = definitions.get(c.getCurrentAction().actionId());
        if (def == null) {
            return null;
        }
        Map<NeedType, Double> rates = def.activeRates();
        return rates.isEmpty() ? null : rates;
    }

    @Override
    public List<ActionId> getAvailableActions(String agentId) {
        List<ActionId> available = new ArrayList<>();
        for (ActionId actionId : definitions.keySet()) {
            if (actionId != ActionId.THINKING && canExecuteAction(agentId, actionId, null, null).allowed()) {
                available.add(actionId);
            }
        }
        return available;
    }

    @Override
    public ActionCheck canExecuteAction(String agentId, ActionId actionId, String facilityId, String targetNpcId) {
        SimCharacter c = world.getCharacter(agentId);
        if (c == null) {
            return ActionCheck.denied("character not found");
        }
        if (actionId == null) {
            return ActionCheck.denied("no action");
        }
        if (actionId == ActionId.THINKING) {
            return c.getCurrentAction() == null ? ActionCheck.ok() : ActionCheck.denied("already executing");
        }
        // The thinking placeholder stands aside for a real action
        if (c.getCurrentAction() != null && !c.getCurrentAction().isThinking()) {
            return ActionCheck.denied("already executing " + c.getCurrentAction().actionId().id());
        }
        if (c.isNavigating()) {
            return ActionCheck.denied("navigating");
        }
        ActionDefinition def = definitions.get(actionId);
        if (def == null) {
            return ActionCheck.denied("no definition for " + actionId.id());
        }

        if (actionId == ActionId.TALK) {
            Npc npc = resolveTalkTarget(c, targetNpcId);
            if (npc == null) {
                return ActionCheck.denied("no NPC to talk to on " + c.getCurrentMapId());
            }
            if (npc.isInConversation()) {
                return ActionCheck.denied(npc.getId() + " is already talking");
            }
            return checkCost(c, def.cost);
        }

        Obstacle facility = resolveFacility(c, facilityId);
        if (facilityId != null && facility == null) {
            return ActionCheck.denied("not at facility " + facilityId);
        }
        if (mapping.requiresFacility(actionId)) {
            if (facility == null) {
                return ActionCheck.denied("requires facility with tags " + mapping.tagsFor(actionId));
            }
            if (!mapping.supports(facility.getFacility(), actionId)) {
                return ActionCheck.denied(facility.getId() + " does not support " + actionId.id());
            }
        }

        if (facility != null) {
            String owner = facility.getFacility().owner();
            if (owner != null && !owner.equals(agentId)) {
                return ActionCheck.denied(String.format("%s is owned by %s", facility.getId(), owner));
            }
        }

        if (actionId == ActionId.WORK) {
            ActionCheck employment = checkEmployment(c, facility);
            if (!employment.allowed()) {
                return employment;
            }
        }

        int cost = facility != null && facility.getFacility().cost() > 0 ? facility.getFacility().cost() : def.cost;
        return checkCost(c, cost);
    }

    @Override
    public Obstacle getCurrentFacility(String agentId) {
        SimCharacter c = world.getCharacter(agentId);
        if (c == null) {
            return null;
        }
        WorldMap map = world.getMap(c.getCurrentMapId());
        return map != null ? locator.findFacilityAt(map, c.getCurrentNodeId()) : null;
    }

    @Override
    public void forceCompleteAction(String agentId) {
        SimCharacter c = world.getCharacter(agentId);
        if (c == null || c.getCurrentAction() == null) {
            return;
        }
        if (c.getCurrentAction().isThinking()) {
            world.clearCurrentAction(agentId);
            return;
        }
        complete(c);
    }

    @Override
    public boolean isExecutingAction(String agentId) {
        SimCharacter c = world.getCharacter(agentId);
        return c != null && c.getCurrentAction() != null;
    }

    private void complete(SimCharacter c) {
        ActionState action = c.getCurrentAction();
        ActionDefinition def = definitions.get(action.actionId());

        if (def != null && def.fixed && def.effects != null && !def.effects.isEmpty()) {
            NeedValues before = c.getNeeds();
            world.updateNeeds(c.getId(), before.plus(def.effects));
            LOGGER.fine(String.format("[ACTION] %s %s: %s -> %s", c.getId(), action.actionId().id(), before, c.getNeeds()));
        }
        if (action.actionId() == ActionId.WORK && c.getEmployment() != null) {
            long minutes = Math.max(0, action.targetEndTime() - action.startTime()) / MILLIS_PER_MINUTE;
            int earnings = (int) Math.floor(c.getEmployment().hourlyWage() * (minutes / 60.0));
            if (earnings > 0) {
                world.setMoney(c.getId(), c.getMoney() + earnings);
                LOGGER.info(String.format("[ACTION] %s earned %d for %d min of work", c.getId(), earnings, minutes));
            }
        }
        if (action.targetNpcId() != null) {
            world.setCharacterConversation(c.getId(), false);
            world.setNpcConversation(action.targetNpcId(), false);
        }

        world.clearCurrentAction(c.getId());
        world.setDisplayEmoji(c.getId(), null);
        LOGGER.info(String.format("[ACTION] %s completed %s", c.getId(), action.actionId().id()));
        events.publish(SimulationEvent.actionCompleted(c.getId(), action.actionId()));
    }

    /**
     * End an action whose completion threw. Effects are skipped but listeners still hear that it ended.
     */
    private void abandon(String agentId, ActionState action) {
        world.clearCurrentAction(agentId);
        world.setDisplayEmoji(agentId, null);
        if (action.targetNpcId() != null) {
            world.setCharacterConversation(agentId, false);
            world.setNpcConversation(action.targetNpcId(), false);
        }
        events.publish(SimulationEvent.actionCompleted(agentId, action.actionId()));
    }

    private Obstacle resolveFacility(SimCharacter c, String facilityId) {
        WorldMap map = world.getMap(c.getCurrentMapId());
        if (map == null) {
            return null;
        }
        if (facilityId == null) {
            return locator.findFacilityAt(map, c.getCurrentNodeId());
        }
        Obstacle obstacle = map.findObstacle(facilityId).orElse(null);
        if (obstacle == null || !obstacle.hasFacility()
                || !locator.isNodeAtFacility(map, c.getCurrentNodeId(), obstacle)) {
            return null;
        }
        return obstacle;
    }

    private Npc resolveTalkTarget(SimCharacter c, String targetNpcId) {
        if (targetNpcId != null) {
            Npc npc = world.getNpc(targetNpcId);
            return npc != null && npc.getMapId().equals(c.getCurrentMapId()) ? npc : null;
        }
        List<Npc> onMap = world.getNpcsOnMap(c.getCurrentMapId());
        return onMap.isEmpty() ? null : onMap.get(0);
    }

    private ActionCheck checkCost(SimCharacter c, int cost) {
        if (cost > 0 && c.getMoney() < cost) {
            return ActionCheck.denied(String.format("not enough money: %d < %d", c.getMoney(), cost));
        }
        return ActionCheck.ok();
    }

    private ActionCheck checkEmployment(SimCharacter c, Obstacle facility) {
        Employment employment = c.getEmployment();
        if (employment == null) {
            return ActionCheck.denied("no employment");
        }
        if (facility == null || !facility.getId().equals(employment.workplaceFacilityId())) {
            return ActionCheck.denied("not at workplace " + employment.workplaceFacilityId());
        }
        int start = WorldTime.parseMinutes(employment.startTime());
        int end = WorldTime.parseMinutes(employment.endTime());
        if (start < 0 || end < 0) {
            return ActionCheck.denied("invalid work hours " + employment.startTime() + "-" + employment.endTime());
        }
        int now = world.getTime().minutesOfDay();
        boolean onShift = start <= end
                ? now >= start && now < end
                : now >= start || now < end;
        if (!onShift) {
            return ActionCheck.denied(String.format("outside work hours %s-%s (now %s)",
                    employment.startTime(), employment.endTime(), world.getTime().format()));
        }
        return ActionCheck.ok();
    }
}
