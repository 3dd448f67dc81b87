package com.convocommerce.pii.encryption;

import com.convocommerce.pii.domain.DataType;
import lombok.Value;
import org.springframework.util.Assert;

import java.util.Map;

/**
 * Non-secret binding (tokenId, merchantId, dataType) that the key service ties to a
 * ciphertext. Decrypting under any other triple fails.
 */
@Value
public class EncryptionContext {

    public static final String TOKEN_ID = "token_id";
    public static final String MERCHANT_ID = "merchant_id";
    public static final String DATA_TYPE = "data_type";

    String tokenId;
    String merchantId;
    DataType dataType;

    public EncryptionContext(String tokenId, String merchantId, DataType dataType) {
        Assert.hasText(tokenId, "tokenId must not be blank");
        Assert.hasText(merchantId, "merchantId must not be blank");
        Assert.notNull(dataType, "dataType must not be null");
        this.tokenId = tokenId;
        this.merchantId = merchantId;
        this.dataType = dataType;
    }

    public Map<String, String> asMap() {
        return Map.of(
                TOKEN_ID, tokenId,
                MERCHANT_ID, merchantId,
                DATA_TYPE, dataType.wireValue());
    }
}
