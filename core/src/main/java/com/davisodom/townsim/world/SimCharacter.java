package com.davisodom.townsim.world;

import com.davisodom.townsim.model.*;

import java.util.Objects;

/**
 * Autonomous character record.
 *
 * Readable by anyone; writable only through {@link WorldState}, which owns every mutation.
 */
public class SimCharacter {

    private final String id;
    private final String name;
    private final Employment employment;

    private NeedValues needs;
    private int money;
    private String currentMapId;
    private String currentNodeId;
    private Position position;
    private Direction direction = Direction.DOWN;
    private NavigationState navigation = NavigationState.REST;
    private CrossMapNavigationState crossMapNavigation = CrossMapNavigationState.INACTIVE;
    private TransitionState transition;
    private ActionState currentAction;
    private PendingAction pendingAction;
    private int actionCounter;
    private boolean inConversation;
    private String displayEmoji;

    public SimCharacter(String id, String name, String currentMapId, String currentNodeId, Position position,
                        NeedValues needs, int money, Employment employment) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = name != null ? name : id;
        this.currentMapId = Objects.requireNonNull(currentMapId, "currentMapId cannot be null");
        this.currentNodeId = Objects.requireNonNull(currentNodeId, "currentNodeId cannot be null");
        this.position = Objects.requireNonNull(position, "position cannot be null");
        this.needs = needs != null ? needs : NeedValues.full();
        this.money = money;
        this.employment = employment;
    }

    public SimCharacter(String id, String name, String currentMapId, String currentNodeId, Position position) {
        this(id, name, currentMapId, currentNodeId, position, NeedValues.full(), 0, null);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public Employment getEmployment() { return employment; }
    public NeedValues getNeeds() { return needs; }
    public int getMoney() { return money; }
    public String getCurrentMapId() { return currentMapId; }
    public String getCurrentNodeId() { return currentNodeId; }
    public Position getPosition() { return position; }
    public Direction getDirection() { return direction; }
    public NavigationState getNavigation() { return navigation; }
    public CrossMapNavigationState getCrossMapNavigation() { return crossMapNavigation; }
    public TransitionState getTransition() { return transition; }
    public ActionState getCurrentAction() { return currentAction; }
    public PendingAction getPendingAction() { return pendingAction; }
    public int getActionCounter() { return actionCounter; }
    public boolean isInConversation() { return inConversation; }
    public String getDisplayEmoji() { return displayEmoji; }

    public double getNeed(NeedType need) {
        return needs.get(need);
    }

    /**
     * True while walking, following a cross-map route, or fading between maps.
     */
    public boolean isNavigating() {
        return navigation.moving() || crossMapNavigation.active() || transition != null;
    }

    /**
     * Idle agents have no action (placeholder included), no navigation and no conversation.
     */
    public boolean isIdle() {
        return currentAction == null && !isNavigating() && !inConversation;
    }

    void setNeeds(NeedValues needs) { this.needs = needs; }
    void setMoney(int money) { this.money = money; }
    void setCurrentMapId(String currentMapId) { this.currentMapId = currentMapId; }
    void setCurrentNodeId(String currentNodeId) { this.currentNodeId = currentNodeId; }
    void setPosition(Position position) { this.position = position; }
    void setDirection(Direction direction) { this.direction = direction; }
    void setNavigation(NavigationState navigation) { this.navigation = navigation; }
    void setCrossMapNavigation(CrossMapNavigationState state) { this.crossMapNavigation = state; }
    void setTransition(TransitionState transition) { this.transition = transition; }
    void setCurrentAction(ActionState currentAction) { this.currentAction = currentAction; }
    void setPendingAction(PendingAction pendingAction) { this.pendingAction = pendingAction; }
    void setActionCounter(int actionCounter) { this.actionCounter = actionCounter; }
    void setInConversation(boolean inConversation) { this.inConversation = inConversation; }
    void setDisplayEmoji(String displayEmoji) { this.displayEmoji = displayEmoji; }

    @Override
    public String toString() {
        return String.format("SimCharacter{id=%s, map=%s, node=%s, action=%s, moving=%s}",
                id, currentMapId, currentNodeId,
                currentAction != null ? currentAction.actionId().id() : "none", navigation.moving());
    }
}
