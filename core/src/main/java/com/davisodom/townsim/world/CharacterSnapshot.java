package com.davisodom.townsim.world;

import com.davisodom.townsim.model.*;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Serialized form of a {@link SimCharacter}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CharacterSnapshot(String id,
                                String name,
                                Map<NeedType, Double> needs,
                                int money,
                                String currentMapId,
                                String currentNodeId,
                                Position position,
                                Direction direction,
                                NavigationState navigation,
                                CrossMapNavigationState crossMapNavigation,
                                TransitionState transition,
                                ActionState currentAction,
                                PendingAction pendingAction,
                                int actionCounter,
                                boolean inConversation,
                                String displayEmoji,
                                Employment employment) {

    static CharacterSnapshot of(SimCharacter c) {
        return new CharacterSnapshot(c.getId(), c.getName(), c.getNeeds().asMap(), c.getMoney(),
                c.getCurrentMapId(), c.getCurrentNodeId(), c.getPosition(), c.getDirection(),
                c.getNavigation(), c.getCrossMapNavigation(), c.getTransition(), c.getCurrentAction(),
                c.getPendingAction(), c.getActionCounter(), c.isInConversation(), c.getDisplayEmoji(),
                c.getEmployment());
    }
}
