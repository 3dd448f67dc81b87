package com.convocommerce.pii.repository;

import com.convocommerce.pii.config.PiiTokenizationProperties;
import com.convocommerce.pii.domain.DataType;
import com.convocommerce.pii.domain.PiiToken;
import com.convocommerce.pii.exception.TokenIdCollisionException;
import com.convocommerce.pii.exception.TokenPersistenceException;
import com.convocommerce.pii.exception.UnreadableTokenRecordException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token records in a DynamoDB table with partition key {@code token_id} and sort key
 * {@code merchant_id}. Writes are conditional on the token id being unused and carry
 * an epoch-seconds {@code ttl} attribute for native expiry when enabled.
 */
@Slf4j
@Repository
public class DynamoDbTokenStore implements TokenStore {

    static final String TOKEN_ID = "token_id";
    static final String MERCHANT_ID = "merchant_id";
    static final String ENCRYPTED_VALUE = "encrypted_value";
    static final String DATA_TYPE = "data_type";
    static final String CREATED_AT = "created_at";
    static final String EXPIRES_AT = "expires_at";
    static final String OWNER_ID = "owner_id";
    static final String TTL = "ttl";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final boolean nativeTtlEnabled;

    public DynamoDbTokenStore(DynamoDbClient dynamoDbClient, PiiTokenizationProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = properties.getTokenStore().getTableName();
        this.nativeTtlEnabled = properties.getTokenStore().isNativeTtlEnabled();
    }

    @Override
    public void put(PiiToken token) {
        try {
            dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(toItem(token))
                    .conditionExpression("attribute_not_exists(" + TOKEN_ID + ")")
                    .build());

        } catch (ConditionalCheckFailedException e) {
            log.warn("Token id collision on {}", token.getTokenId());
            throw new TokenIdCollisionException(token.getTokenId(), e);
        } catch (SdkException e) {
            log.error("Failed to store token {} for merchant {}: {}",
                    token.getTokenId(), token.getMerchantId(), e.getMessage());
            throw new TokenPersistenceException("Failed to store token mapping: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<PiiToken> get(String tokenId, String merchantId) {
        try {
            GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(tokenId, merchantId))
                    .consistentRead(true)
                    .build());

            if (!response.hasItem() || response.item().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(fromItem(response.item()));

        } catch (SdkException e) {
            log.error("Failed to load token {}: {}", tokenId, e.getMessage());
            throw new TokenPersistenceException("Failed to load token mapping: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String tokenId, String merchantId) {
        try {
            dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(key(tokenId, merchantId))
                    .build());

        } catch (SdkException e) {
            log.error("Failed to delete token {}: {}", tokenId, e.getMessage());
            throw new TokenPersistenceException("Failed to delete token mapping: " + e.getMessage(), e);
        }
    }

    private Map<String, AttributeValue> key(String tokenId, String merchantId) {
        Map<String, AttributeValue> key = new HashMap<>();
        key.put(TOKEN_ID, AttributeValue.fromS(tokenId));
        key.put(MERCHANT_ID, AttributeValue.fromS(merchantId));
        return key;
    }

    Map<String, AttributeValue> toItem(PiiToken token) {
        Map<String, AttributeValue> item = key(token.getTokenId(), token.getMerchantId());
        item.put(ENCRYPTED_VALUE, AttributeValue.fromB(SdkBytes.fromByteArray(token.getEncryptedValue())));
        item.put(DATA_TYPE, AttributeValue.fromS(token.getDataType().wireValue()));
        item.put(CREATED_AT, AttributeValue.fromS(token.getCreatedAt().toString()));
        if (token.getExpiresAt() != null) {
            item.put(EXPIRES_AT, AttributeValue.fromS(token.getExpiresAt().toString()));
            if (nativeTtlEnabled) {
                item.put(TTL, AttributeValue.fromN(Long.toString(token.getExpiresAt().getEpochSecond())));
            }
        }
        if (token.getOwnerId() != null) {
            item.put(OWNER_ID, AttributeValue.fromS(token.getOwnerId()));
        }
        return item;
    }

    /**
     * @throws UnreadableTokenRecordException if a required attribute is missing or malformed
     */
    PiiToken fromItem(Map<String, AttributeValue> item) {
        String tokenId = requiredString(item, TOKEN_ID, null);
        try {
            return PiiToken.builder()
                    .tokenId(tokenId)
                    .merchantId(requiredString(item, MERCHANT_ID, tokenId))
                    .encryptedValue(requiredBinary(item, ENCRYPTED_VALUE, tokenId))
                    .dataType(DataType.fromWireValue(requiredString(item, DATA_TYPE, tokenId)))
                    .createdAt(Instant.parse(requiredString(item, CREATED_AT, tokenId)))
                    .expiresAt(item.containsKey(EXPIRES_AT) ? Instant.parse(requiredString(item, EXPIRES_AT, tokenId)) : null)
                    .ownerId(item.containsKey(OWNER_ID) ? item.get(OWNER_ID).s() : null)
                    .build();

        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new UnreadableTokenRecordException(tokenId, e.getMessage(), e);
        }
    }

    private static String requiredString(Map<String, AttributeValue> item, String name, String tokenId) {
        AttributeValue value = item.get(name);
        if (value == null || value.s() == null) {
            throw new UnreadableTokenRecordException(tokenId, "missing " + name, null);
        }
        return value.s();
    }

    private static byte[] requiredBinary(Map<String, AttributeValue> item, String name, String tokenId) {
        AttributeValue value = item.get(name);
        if (value == null || value.b() == null) {
            throw new UnreadableTokenRecordException(tokenId, "missing " + name, null);
        }
        return value.b().asByteArray();
    }
}
