package com.davisodom.townsim.behavior;

import com.davisodom.townsim.model.ActionId;
import com.davisodom.townsim.model.BehaviorDecision;

import java.util.concurrent.CompletableFuture;

/**
 * Pluggable decision strategy.
 *
 * Implementations may take arbitrarily long and may complete on any thread. They must not
 * touch the world; the returned decision is applied later on the tick thread, and only if the
 * agent is still idle by then.
 */
public interface BehaviorDecider {

    CompletableFuture<BehaviorDecision> decide(BehaviorContext context);

    /**
     * Pick where to perform {@code forcedAction}. The category is fixed; only the facility or
     * NPC is up to the decider. An idle decision means nothing suitable was found.
     */
    CompletableFuture<BehaviorDecision> decideInterruptFacility(ActionId forcedAction, BehaviorContext context);
}
