package com.team.buildrelay.model.event;

import java.util.Locale;

/**
 * Build result as reported in {@code build.state}. Buildkite sends lower-case
 * names; anything else, including other casings, is {@link #UNKNOWN}.
 */
public enum BuildState {
    RUNNING, PASSED, FAILED, CANCELED, UNKNOWN;

    public static BuildState fromWireName(String state) {
        if (state == null) return UNKNOWN;
        for (BuildState value : values()) {
            if (value != UNKNOWN && value.wireName().equals(state)) {
                return value;
            }
        }
        return UNKNOWN;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
