package org.mediatagger.model;

import org.mediatagger.controller.util.StringUtils;

/**
 * GPS coordinates exactly as an XMP sidecar stores them, e.g. latitude
 * {@code "32,54.99N"}, longitude {@code "96,32.052W"}, altitude {@code "741/5"}.
 *
 * @param latitude  degrees and decimal minutes with a hemisphere letter
 * @param longitude degrees and decimal minutes with a hemisphere letter
 * @param altitude  meters, possibly as a rational; may be null
 */
public record GpsPosition(String latitude, String longitude, String altitude) {

    public GpsPosition {
        latitude = StringUtils.trimToNull(latitude);
        longitude = StringUtils.trimToNull(longitude);
        altitude = StringUtils.trimToNull(altitude);
    }

    /**
     * @return true if both latitude and longitude are present
     */
    public boolean isComplete() {
        return latitude != null && longitude != null;
    }
}
