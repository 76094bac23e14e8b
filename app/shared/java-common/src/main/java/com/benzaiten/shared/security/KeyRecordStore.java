package com.benzaiten.shared.security;

import com.benzaiten.shared.security.exception.KeyRecordStoreException;

import java.util.Optional;

/**
 * API Key 레코드 조회 포트
 *
 * <p>구현체는 공개키, 요청 메서드의 위치 속성, 만료일만 조회해야 합니다.</p>
 */
public interface KeyRecordStore {

    /**
     * @param apiKey API Key ID
     * @param method 위치 속성을 선택할 메서드
     * @return 레코드, 존재하지 않으면 empty
     * @throws KeyRecordStoreException 저장소 호출 실패
     */
    Optional<KeyRecord> find(String apiKey, AccessMethod method);
}
