package com.ryuqq.asyncop.core.collection;

/**
 * 컬렉션 변경 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ChangeKind {

    /**
     * 하나 이상의 항목 추가 (batch는 한 번의 알림).
     */
    ADD,

    /**
     * 항목 제거.
     */
    REMOVE,

    /**
     * 항목 위치 이동.
     */
    MOVE,

    /**
     * 전체 내용 교체 또는 비움.
     */
    RESET
}
