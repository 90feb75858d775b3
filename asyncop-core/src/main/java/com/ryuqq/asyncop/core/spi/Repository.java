package com.ryuqq.asyncop.core.spi;

import java.util.List;

/**
 * 도메인 레코드 조회 SPI.
 *
 * <p>일시적 또는 영구적 오류를 던질 수 있습니다. 코어는 오류 종류를 구분하지 않으며,
 * 취소가 아닌 모든 오류를 설정된 한도까지 재시도 대상으로 취급합니다.</p>
 *
 * @param <T> 레코드 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Repository<T> {

    /**
     * 전체 레코드 조회.
     *
     * @return 레코드 목록 (순서 보존, null 요소 불가)
     * @throws Exception 조회 실패 시
     */
    List<T> fetchAll() throws Exception;
}
