package com.ryuqq.asyncop.core.statemachine;

/**
 * 하나의 Operation 생명주기 단계.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *    │
 *    ▼ (실행 시작)
 * LOADING
 *    │
 *    ├─► SUCCEEDED ─┐
 *    ├─► CANCELLED ─┼─► (cleanup) ─► IDLE
 *    └─► FAILED ────┘
 * </pre>
 *
 * <p>세 종료 상태 모두 동일한 cleanup 경로를 거쳐 IDLE로 돌아갑니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OperationPhase {

    /**
     * 대기 중.
     */
    IDLE,

    /**
     * 실행 중 (IsLoading=true).
     */
    LOADING,

    /**
     * 성공.
     */
    SUCCEEDED,

    /**
     * 취소.
     */
    CANCELLED,

    /**
     * 실패.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED, CANCELLED, FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == CANCELLED || this == FAILED;
    }
}
