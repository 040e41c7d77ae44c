package com.petmind.shared.model;

/**
 * Known event kind tags. The set is open: any other non-blank tag is accepted
 * and handled as {@link EventPayload.Generic}.
 */
public final class EventKinds {

    public static final String CHAT = "chat";
    public static final String VISION = "vision";
    public static final String APP_ACTIVITY = "app_activity";
    public static final String LOCATION = "location";
    public static final String INVENTORY = "inventory";
    public static final String SKILL = "skill";
    public static final String PREFERENCE = "preference";
    public static final String UNKNOWN = "unknown";

    private EventKinds() {}

    public static String normalize(String kind) {
        if (kind == null || kind.isBlank()) return UNKNOWN;
        return kind.trim();
    }
}
