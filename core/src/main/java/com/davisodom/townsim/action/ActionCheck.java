package com.davisodom.townsim.action;

/**
 * Outcome of an action precondition check.
 *
 * @param reason why the action cannot run, null when it can
 */
public record ActionCheck(boolean allowed, String reason) {

    private static final ActionCheck OK = new ActionCheck(true, null);

    public static ActionCheck ok() {
        return OK;
    }

    public static ActionCheck denied(String reason) {
        return new ActionCheck(false, reason);
    }
}
