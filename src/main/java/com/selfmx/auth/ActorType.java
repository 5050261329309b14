package com.selfmx.auth;

import java.util.Locale;

/**
 * Who performed an action.
 */
public enum ActorType {
    API_KEY,
    ADMIN,
    SYSTEM;

    /**
     * Gets the lowercase name stored in audit rows.
     *
     * @return Name.
     */
    public String apiName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
