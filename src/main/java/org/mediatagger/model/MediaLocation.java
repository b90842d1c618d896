package org.mediatagger.model;

import org.mediatagger.controller.util.StringUtils;

/**
 * Where a photo or video was taken. Every component is optional and
 * independent of the others; a sidecar may carry a state without a
 * location name, or a location name without a state.
 *
 * @param location a named place (venue, landmark, sub-location); may be null
 * @param city     may be null
 * @param state    state or province; may be null
 * @param country  may be null
 */
public record MediaLocation(String location, String city, String state, String country) {

    public static final MediaLocation EMPTY = new MediaLocation(null, null, null, null);

    public MediaLocation {
        location = StringUtils.trimToNull(location);
        city = StringUtils.trimToNull(city);
        state = StringUtils.trimToNull(state);
        country = StringUtils.trimToNull(country);
    }

    public boolean isEmpty() {
        return location == null && city == null && state == null && country == null;
    }

    /**
     * Fill each missing component from another location.
     *
     * @param fallback the location to take missing components from
     * @return a location with this location's components, completed by fallback's
     */
    public MediaLocation orElse(MediaLocation fallback) {
        if (fallback == null) {
            return this;
        }
        return new MediaLocation(
            location != null ? location : fallback.location,
            city != null ? city : fallback.city,
            state != null ? state : fallback.state,
            country != null ? country : fallback.country
        );
    }

    /**
     * The single human-readable place string written to location tags:
     * location (or, lacking one, state), city and country, comma separated.
     * The city is left out when it repeats the first part.
     *
     * @return the combined string, or null if there is nothing to combine
     */
    public String combined() {
        StringBuilder sb = new StringBuilder();
        String first = (location != null) ? location : state;
        if (first != null) {
            sb.append(first);
        }
        if (city != null && !city.equals(first)) {
            appendPart(sb, city);
        }
        if (country != null) {
            appendPart(sb, country);
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    private static void appendPart(StringBuilder sb, String part) {
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(part);
    }
}
