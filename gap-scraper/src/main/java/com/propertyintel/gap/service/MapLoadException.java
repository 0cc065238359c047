package com.propertyintel.gap.service;

/**
 * The map page for an asset type could not be loaded.
 */
public class MapLoadException extends RuntimeException {

    public MapLoadException(String message) {
        super(message);
    }
}
