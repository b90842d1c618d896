package org.mediatagger.controller.metadata;

/**
 * The kinds of metadata field the pipeline reads, writes and verifies.  Each
 * kind maps to one or more concrete tag names through a {@link TagTable}.
 * {@link #RATING} is only ever read.
 */
public enum FieldKind {
    TITLE,
    KEYWORDS,
    DATE,
    CAPTION,
    LOCATION,
    CITY,
    STATE,
    COUNTRY,
    GPS,
    RATING
}
