package com.rebenew.musicParty.queuesync.error;

public class NotAuthorizedException extends SessionException {
    public NotAuthorizedException(String message) {
        super(ErrorCode.NOT_AUTHORIZED, message);
    }
}
