package com.convocommerce.pii.exception;

import lombok.Getter;

/**
 * A conditional write found an existing record under the freshly minted token id.
 */
@Getter
public class TokenIdCollisionException extends TokenPersistenceException {

    private final String tokenId;

    public TokenIdCollisionException(String tokenId, Throwable cause) {
        super(ErrorCode.TOKEN_ID_COLLISION, "Token id already exists: " + tokenId, cause);
        this.tokenId = tokenId;
    }
}
