package com.coursecatalog.scraper;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Normalized room/building pair. Either side may be null.
 */
public record Location(String room, String building) {
    public static final String ANNOUNCED_LATER = "To be announced";

    public static Location announcedLater() {
        return new Location(null, ANNOUNCED_LATER);
    }

    @JsonIgnore
    public boolean isAnnouncedLater() {
        return room == null && ANNOUNCED_LATER.equals(building);
    }
}
