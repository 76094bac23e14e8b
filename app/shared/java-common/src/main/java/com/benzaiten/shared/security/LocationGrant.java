package com.benzaiten.shared.security;

import com.benzaiten.shared.security.exception.MalformedKeyRecordException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * API Key의 메서드별 위치 권한
 *
 * <p>저장소에는 다음 세 가지 형태 중 하나로 저장됩니다.</p>
 * <ul>
 *   <li>단일 문자열: {@code "*"}이면 모든 위치 허용, 그 외 값은 어떤 위치도 허용하지 않음</li>
 *   <li>문자열 집합: 집합에 포함된 위치만 허용 (대소문자 구분, 완전 일치)</li>
 *   <li>그 밖의 형태: 손상된 레코드로 간주</li>
 * </ul>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LocationGrant {

    public static final String WILDCARD = "*";

    public enum Kind {
        SCALAR,
        SET,
        UNSUPPORTED
    }

    private final Kind kind;
    private final String scalar;
    private final Set<String> locations;

    /**
     * UNSUPPORTED인 경우 저장소에서 읽은 속성 형태 (로그용)
     */
    private final String description;

    private LocationGrant(Kind kind, String scalar, Set<String> locations, String description) {
        this.kind = kind;
        this.scalar = scalar;
        this.locations = locations;
        this.description = description;
    }

    public static LocationGrant scalar(String value) {
        return new LocationGrant(Kind.SCALAR, value, Collections.emptySet(), null);
    }

    public static LocationGrant wildcard() {
        return scalar(WILDCARD);
    }

    public static LocationGrant of(Set<String> locations) {
        return new LocationGrant(Kind.SET, null,
                Collections.unmodifiableSet(new LinkedHashSet<>(locations)), null);
    }

    public static LocationGrant unsupported(String description) {
        return new LocationGrant(Kind.UNSUPPORTED, null, Collections.emptySet(), description);
    }

    /**
     * 요청 위치에 대한 접근 허용 여부
     *
     * @param location 요청 위치 ID
     * @return 허용되면 true
     * @throws MalformedKeyRecordException 지원하지 않는 속성 형태인 경우
     */
    public boolean permits(String location) {
        switch (kind) {
            case SCALAR:
                return WILDCARD.equals(scalar);
            case SET:
                return location != null && locations.contains(location);
            default:
                throw new MalformedKeyRecordException("Unsupported location attribute: " + description);
        }
    }
}
