package com.convocommerce.pii.exception;

import lombok.Getter;

/**
 * A stored record exists but cannot be mapped back to a token: a required attribute is
 * missing or holds a value this service does not understand.
 */
@Getter
public class UnreadableTokenRecordException extends TokenPersistenceException {

    private final String tokenId;

    public UnreadableTokenRecordException(String tokenId, String reason, Throwable cause) {
        super(ErrorCode.TOKEN_RECORD_UNREADABLE, "Unreadable token record " + tokenId + ": " + reason, cause);
        this.tokenId = tokenId;
    }
}
