package com.chatlive.realtime.ratelimit;

public enum Enforcement {
    /** Over the limit: denied and blocked for the module's block duration. */
    HARD,
    /** Over the limit: allowed, flagged as exceeded and logged. */
    SOFT
}
