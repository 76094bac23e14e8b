package com.benzaiten.shared.security;

import java.util.Optional;

/**
 * API Key로 인가할 수 있는 HTTP 메서드와, 메서드별 위치 권한 속성 이름
 */
public enum AccessMethod {

    GET("location_get"),
    PUT("location_put");

    private final String locationAttribute;

    AccessMethod(String locationAttribute) {
        this.locationAttribute = locationAttribute;
    }

    /**
     * Key Record에서 이 메서드의 위치 권한을 담은 속성 이름
     */
    public String getLocationAttribute() {
        return locationAttribute;
    }

    /**
     * HTTP 메서드 문자열을 변환합니다. 대소문자를 구분하며 GET/PUT 외에는 empty를 반환합니다.
     */
    public static Optional<AccessMethod> from(String method) {
        if (method == null) {
            return Optional.empty();
        }
        for (AccessMethod value : values()) {
            if (value.name().equals(method)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
