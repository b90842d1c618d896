package org.mediatagger.controller;

/**
 * The album mapping document could not be read or parsed.
 */
public class AlbumMappingException extends Exception {

    private static final long serialVersionUID = 1L;

    public AlbumMappingException(String message) {
        super(message);
    }

    public AlbumMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
