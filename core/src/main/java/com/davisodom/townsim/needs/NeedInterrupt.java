package com.davisodom.townsim.needs;

import com.davisodom.townsim.model.NeedType;

/**
 * A need that just fell below the interrupt threshold.
 */
public record NeedInterrupt(String agentId, NeedType need, double previousValue, double newValue) {
}
