package com.benzaiten.shared.security;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * API Key 저장소의 레코드 (읽기 전용)
 *
 * <p>저장소 조회 시 요청 메서드의 위치 속성만 projection 하므로,
 * 조회하지 않은 메서드의 위치 권한은 null입니다.</p>
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class KeyRecord {

    /**
     * RSA 공개키 (PEM 또는 DER), 레코드에 없으면 null
     */
    @ToString.Exclude
    private final byte[] publicKey;

    private final LocationGrant locationGet;

    private final LocationGrant locationPut;

    /**
     * 만료일 (UTC, "yyyy-MM-dd HH:mm:ss"), 없으면 만료되지 않는 키
     */
    private final String expirationDateUtc;

    public LocationGrant locationFor(AccessMethod method) {
        return method == AccessMethod.GET ? locationGet : locationPut;
    }
}
