package org.mediatagger.controller;

import org.mediatagger.model.AlbumMappings;

/**
 * Supplies the album mapping table.  Called once per resolution, so an
 * implementation backed by a file sees edits without a restart.
 */
@FunctionalInterface
public interface AlbumMappingSource {

    /**
     * @return the current mappings; never null
     * @throws AlbumMappingException if the document is missing, unreadable or malformed
     */
    AlbumMappings load() throws AlbumMappingException;
}
