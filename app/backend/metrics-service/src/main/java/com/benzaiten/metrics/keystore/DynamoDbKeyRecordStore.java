package com.benzaiten.metrics.keystore;

import com.benzaiten.metrics.common.config.BenzaitenProperties;
import com.benzaiten.shared.security.AccessMethod;
import com.benzaiten.shared.security.KeyRecord;
import com.benzaiten.shared.security.KeyRecordStore;
import com.benzaiten.shared.security.LocationGrant;
import com.benzaiten.shared.security.exception.KeyRecordStoreException;
import com.benzaiten.shared.security.exception.MalformedKeyRecordException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnConsumedCapacity;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;

/**
 * DynamoDB API Key 테이블 조회
 *
 * 테이블 스키마:
 * - api_key (PK, S)
 * - pub_key (B): RSA 공개키
 * - location_get / location_put (S 또는 SS): "*" 또는 허용 위치 집합
 * - expiration_date_utc (S, 선택): "yyyy-MM-dd HH:mm:ss"
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DynamoDbKeyRecordStore implements KeyRecordStore {

    static final String KEY_ATTRIBUTE = "api_key";
    static final String PUB_KEY_ATTRIBUTE = "pub_key";
    static final String EXPIRATION_ATTRIBUTE = "expiration_date_utc";

    private static final String OPERATION = "GetItem";

    private final DynamoDbClient dynamoDbClient;
    private final BenzaitenProperties properties;

    @Override
    public Optional<KeyRecord> find(String apiKey, AccessMethod method) {
        String locationAttribute = method.getLocationAttribute();

        GetItemRequest request = GetItemRequest.builder()
                .tableName(properties.getDynamodb().getTableName())
                .key(Map.of(KEY_ATTRIBUTE, AttributeValue.fromS(apiKey)))
                .projectionExpression(String.join(", ",
                        PUB_KEY_ATTRIBUTE, locationAttribute, EXPIRATION_ATTRIBUTE))
                .returnConsumedCapacity(ReturnConsumedCapacity.TOTAL)
                .build();

        GetItemResponse response;
        try {
            response = dynamoDbClient.getItem(request);
        } catch (AwsServiceException e) {
            String errorCode = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
            throw KeyRecordStoreException.fromErrorCode(errorCode, OPERATION, e);
        } catch (SdkException e) {
            throw KeyRecordStoreException.fromErrorCode(null, OPERATION, e);
        }

        if (response.consumedCapacity() != null) {
            log.debug("Consumed capacity: {}", response.consumedCapacity().capacityUnits());
        }

        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(toKeyRecord(response.item(), method));
    }

    static KeyRecord toKeyRecord(Map<String, AttributeValue> item, AccessMethod method) {
        LocationGrant grant = toLocationGrant(item.get(method.getLocationAttribute()));

        return KeyRecord.builder()
                .publicKey(toPublicKey(item.get(PUB_KEY_ATTRIBUTE)))
                .expirationDateUtc(toExpirationDate(item.get(EXPIRATION_ATTRIBUTE)))
                .locationGet(method == AccessMethod.GET ? grant : null)
                .locationPut(method == AccessMethod.PUT ? grant : null)
                .build();
    }

    private static byte[] toPublicKey(AttributeValue value) {
        if (value == null) {
            return null;
        }
        if (value.b() == null) {
            throw new MalformedKeyRecordException(PUB_KEY_ATTRIBUTE + " is not binary: " + value.type());
        }
        return value.b().asByteArray();
    }

    private static String toExpirationDate(AttributeValue value) {
        if (value == null) {
            return null;
        }
        if (value.s() == null) {
            throw new MalformedKeyRecordException(EXPIRATION_ATTRIBUTE + " is not a string: " + value.type());
        }
        return value.s();
    }

    private static LocationGrant toLocationGrant(AttributeValue value) {
        if (value == null) {
            return null;
        }
        if (value.s() != null) {
            return LocationGrant.scalar(value.s());
        }
        if (value.hasSs()) {
            return LocationGrant.of(new LinkedHashSet<>(value.ss()));
        }
        return LocationGrant.unsupported(String.valueOf(value.type()));
    }
}
