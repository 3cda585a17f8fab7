package com.rebenew.musicParty.queuesync.error;

/**
 * El objetivo del comando no existe o está en un estado que no admite la operación.
 */
public class InvalidTargetException extends SessionException {
    public InvalidTargetException(String message) {
        super(ErrorCode.INVALID_TARGET, message);
    }
}
