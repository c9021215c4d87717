package com.dingdangmaoup.contentpool.model;

import java.util.Locale;

/**
 * Kind of installable content a manifest describes
 */
public enum ContentType {
    GAME_INSTALLATION,
    GAME_CLIENT,
    MOD,
    PATCH,
    ADDON,
    MAP_PACK,
    MAP,
    MISSION,
    LANGUAGE_PACK,
    MODDING_TOOL,
    EXECUTABLE,
    CONTENT_BUNDLE,
    PUBLISHER_REFERRAL,
    CONTENT_REFERRAL,
    REPLAY,
    SCREENSAVER,
    SKIN,
    VIDEO,
    UNKNOWN;

    /**
     * Base content may declare no files; its payload is supplied by an external installation.
     */
    public boolean isBase() {
        return this == GAME_INSTALLATION || this == GAME_CLIENT;
    }

    /**
     * Lowercase token used inside generated manifest ids
     */
    public String idToken() {
        return name().replace("_", "").toLowerCase(Locale.ROOT);
    }
}
