package com.ryuqq.asyncop.core.collection;

import java.util.List;

/**
 * 하나의 논리적 호출에 대응하는 컬렉션 변경 알림.
 *
 * @param kind 변경 종류
 * @param items 변경된 항목 (ADD: 추가된 항목, REMOVE/MOVE: 대상 항목, RESET: 새 전체 내용)
 * @param index 변경 위치 (ADD: 시작 index, REMOVE: 제거 전 index, MOVE: 새 index, RESET: 0)
 * @param snapshot 변경 적용 후 전체 내용
 * @param <T> 항목 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CollectionChange<T>(ChangeKind kind, List<T> items, int index, List<T> snapshot) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind, items, snapshot이 null인 경우
     */
    public CollectionChange {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (items == null || snapshot == null) {
            throw new IllegalArgumentException("items and snapshot cannot be null");
        }
        items = List.copyOf(items);
    }
}
