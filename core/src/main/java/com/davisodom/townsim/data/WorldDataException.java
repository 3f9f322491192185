package com.davisodom.townsim.data;

/**
 * Static world data is missing, malformed or inconsistent. Fatal at load time.
 */
public class WorldDataException extends RuntimeException {

    public WorldDataException(String message) {
        super(message);
    }

    public WorldDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
