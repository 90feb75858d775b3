package com.ryuqq.asyncop.core.collection;

/**
 * 컬렉션 변경 리스너.
 *
 * <p>항상 UI 컨텍스트에서 호출됩니다.</p>
 *
 * @param <T> 항목 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CollectionChangeListener<T> {

    /**
     * 변경 알림 수신.
     *
     * @param change 적용된 변경
     */
    void onChanged(CollectionChange<T> change);
}
