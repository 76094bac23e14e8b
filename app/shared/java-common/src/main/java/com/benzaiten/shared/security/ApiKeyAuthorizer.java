package com.benzaiten.shared.security;

import com.benzaiten.shared.response.ApiStatus;
import com.benzaiten.shared.security.exception.KeyRecordStoreException;
import com.benzaiten.shared.security.exception.MalformedKeyRecordException;
import com.benzaiten.shared.util.CanonicalDateTime;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * 외부 API 호출 시 API Key, 메시지 서명, 위치 권한을 검증하는 인가기.
 *
 * <p>유효한 호출의 조건:</p>
 * <ul>
 *   <li>메서드는 GET 또는 PUT</li>
 *   <li>API Key가 저장소에 존재하고 만료되지 않았을 것</li>
 *   <li>API Key가 요청 위치에 대해 해당 메서드 권한을 가질 것</li>
 *   <li>서명(X-Bztn-Sign)이 API Key의 공개키로 메시지를 서명한 값일 것</li>
 * </ul>
 *
 * <p>결과 코드:</p>
 * <pre>
 * 405  GET/PUT 이외의 메서드
 * 418  signature == "earlgrey" (다른 조건과 무관, 저장소 조회 전)
 * 503  저장소 처리량 초과 (ProvisionedThroughputExceededException, RequestLimitExceeded)
 * 511  저장소 접근 권한 없음 (UnauthorizedOperation)
 * 500  그 외 저장소 오류, 손상된 레코드, 파싱 불가능한 만료일
 * 403  존재하지 않는 키, 만료된 키, 허용되지 않은 위치
 * 401  서명 검증 실패
 * 200  접근 허용
 * </pre>
 *
 * <p>모든 실패는 예외 없이 {@link AuthorizationDecision}으로 반환됩니다.</p>
 */
@Slf4j
public class ApiKeyAuthorizer {

    public static final String TEAPOT_SIGNATURE = "earlgrey";

    private final KeyRecordStore keyRecordStore;
    private final RsaSignatureVerifier signatureVerifier;
    private final Clock clock;

    public ApiKeyAuthorizer(KeyRecordStore keyRecordStore, RsaSignatureVerifier signatureVerifier, Clock clock) {
        this.keyRecordStore = keyRecordStore;
        this.signatureVerifier = signatureVerifier;
        this.clock = clock;
    }

    /**
     * 요청 처리 가능 여부를 판단합니다.
     *
     * @param apiKey    클라이언트 API Key
     * @param message   서명된 요청 메시지 원본 바이트
     * @param signature base64 메시지 서명
     * @param location  요청 위치 ID
     * @param method    HTTP 메서드
     * @return 인가 결과
     */
    public AuthorizationDecision decide(String apiKey, byte[] message, String signature,
                                        String location, String method) {
        Optional<AccessMethod> accessMethod = AccessMethod.from(method);
        if (accessMethod.isEmpty()) {
            log.error("Invalid method: {}", method);
            return AuthorizationDecision.of(ApiStatus.METHOD_NOT_ALLOWED);
        }
        if (TEAPOT_SIGNATURE.equals(signature)) {
            log.info("Teapot");
            return AuthorizationDecision.of(ApiStatus.TEAPOT);
        }

        Optional<KeyRecord> found;
        try {
            found = keyRecordStore.find(apiKey, accessMethod.get());
        } catch (KeyRecordStoreException e) {
            log.error(e.getMessage());
            return AuthorizationDecision.of(toStatus(e.getReason()));
        } catch (MalformedKeyRecordException e) {
            log.error("Malformed key record for {}: {}", apiKey, e.getMessage());
            return AuthorizationDecision.of(ApiStatus.INTERNAL_SERVER_ERROR);
        } catch (RuntimeException e) {
            log.error("Unexpected error getting api key {}", apiKey, e);
            return AuthorizationDecision.of(ApiStatus.INTERNAL_SERVER_ERROR);
        }

        if (found.isEmpty()) {
            log.info("{} not found", apiKey);
            return AuthorizationDecision.of(ApiStatus.INVALID_KEY);
        }

        return check(apiKey, found.get(), accessMethod.get(), message, signature, location);
    }

    private AuthorizationDecision check(String apiKey, KeyRecord record, AccessMethod method,
                                        byte[] message, String signature, String location) {
        // 만료일
        if (record.getExpirationDateUtc() != null) {
            LocalDateTime expirationDate;
            try {
                expirationDate = CanonicalDateTime.parse(record.getExpirationDateUtc());
            } catch (DateTimeParseException e) {
                log.error("Invalid date: {}", record.getExpirationDateUtc());
                return AuthorizationDecision.of(ApiStatus.INTERNAL_SERVER_ERROR);
            }
            // 만료일은 초 단위, 현재 시각은 절삭하지 않고 비교
            LocalDateTime now = LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
            if (expirationDate.isBefore(now)) {
                log.info("Expired API Key: {}", apiKey);
                return AuthorizationDecision.of(ApiStatus.EXPIRED_KEY);
            }
        }

        // 위치
        LocationGrant grant = record.locationFor(method);
        if (grant == null) {
            log.error("Unexpected Key error {}: missing {}", apiKey, method.getLocationAttribute());
            return AuthorizationDecision.of(ApiStatus.INTERNAL_SERVER_ERROR);
        }
        try {
            if (!grant.permits(location)) {
                log.error("Location {} not allowed for {}", location, apiKey);
                return AuthorizationDecision.of(ApiStatus.FORBIDDEN);
            }
        } catch (MalformedKeyRecordException e) {
            log.error("Unexpected Key error {}: {}", apiKey, e.getMessage());
            return AuthorizationDecision.of(ApiStatus.INTERNAL_SERVER_ERROR);
        }

        // 서명
        if (record.getPublicKey() == null) {
            log.error("Unexpected Key error {}: missing pub_key", apiKey);
            return AuthorizationDecision.of(ApiStatus.INTERNAL_SERVER_ERROR);
        }
        if (!signatureVerifier.verify(message, signature, record.getPublicKey())) {
            log.info("Signature check failed");
            return AuthorizationDecision.of(ApiStatus.UNAUTHORIZED);
        }

        return AuthorizationDecision.of(ApiStatus.ACCESS_GRANTED);
    }

    private static ApiStatus toStatus(KeyRecordStoreException.Reason reason) {
        switch (reason) {
            case THROTTLED:
                return ApiStatus.SERVICE_UNAVAILABLE;
            case UNAUTHORIZED:
                return ApiStatus.NETWORK_AUTH_REQUIRED;
            default:
                return ApiStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
