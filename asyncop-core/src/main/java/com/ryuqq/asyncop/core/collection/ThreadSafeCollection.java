package com.ryuqq.asyncop.core.collection;

import com.ryuqq.asyncop.core.spi.DispatcherBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 어느 스레드에서나 변경할 수 있는 UI 바인딩용 순서 컬렉션.
 *
 * <p>모든 변경은 UI 컨텍스트에서 적용됩니다. 호출자가 이미 UI 컨텍스트에 있으면
 * 즉시 적용하고, 아니면 {@link DispatcherBridge}로 마샬링합니다. 반환된 Future는
 * 변경이 적용된 뒤 완료됩니다.</p>
 *
 * <p><strong>원자성:</strong></p>
 * <ul>
 *   <li>내부 상태는 불변 스냅샷 하나이며, 변경마다 새 스냅샷으로 한 번에 교체됩니다.</li>
 *   <li>{@link #replaceAllAsync(Collection)}는 "비운 뒤 다시 채우기"가 아니라 단일 교체이므로
 *       읽는 쪽은 빈 중간 상태를 관찰하지 않습니다.</li>
 *   <li>한 번의 호출(batch 포함)은 정확히 한 번의 {@link CollectionChange} 알림을 발생시킵니다.</li>
 * </ul>
 *
 * <p><strong>읽기:</strong> index 접근과 순회는 UI 컨텍스트에서 수행하는 것을 전제로 합니다.
 * 다른 스레드에서의 읽기 안전성은 보장 범위가 아닙니다.</p>
 *
 * <p>null 항목은 허용하지 않으며, 중복 항목은 허용합니다.</p>
 *
 * @param <T> 항목 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ThreadSafeCollection<T> implements Iterable<T> {

    private static final Logger log = LoggerFactory.getLogger(ThreadSafeCollection.class);

    private final DispatcherBridge dispatcher;
    private final List<CollectionChangeListener<T>> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();
    private volatile List<T> items;

    /**
     * 빈 컬렉션 생성.
     *
     * @param dispatcher UI 컨텍스트 마샬러
     * @throws IllegalArgumentException dispatcher가 null인 경우
     */
    public ThreadSafeCollection(DispatcherBridge dispatcher) {
        this(dispatcher, List.of());
    }

    /**
     * 초기 항목으로 컬렉션 생성.
     *
     * @param dispatcher UI 컨텍스트 마샬러
     * @param initialItems 초기 항목
     * @throws IllegalArgumentException dispatcher 또는 initialItems가 null인 경우
     */
    public ThreadSafeCollection(DispatcherBridge dispatcher, Collection<? extends T> initialItems) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        this.dispatcher = dispatcher;
        this.items = copyOf(initialItems);
    }

    /**
     * 전체 내용을 원자적으로 교체.
     *
     * @param newItems 새 내용 (순서 보존)
     * @return 교체 완료 Future
     * @throws IllegalArgumentException newItems가 null이거나 null 요소를 포함한 경우
     */
    public CompletableFuture<Void> replaceAllAsync(Collection<? extends T> newItems) {
        List<T> replacement = copyOf(newItems);
        return mutate(() -> {
            items = replacement;
            notifyListeners(new CollectionChange<>(ChangeKind.RESET, replacement, 0, replacement));
            return null;
        });
    }

    /**
     * 항목 하나를 끝에 추가.
     *
     * @param item 추가할 항목
     * @return 추가 완료 Future
     */
    public CompletableFuture<Void> addAsync(T item) {
        requireItem(item);
        return addRangeAsync(List.of(item));
    }

    /**
     * 여러 항목을 끝에 추가 (알림 한 번).
     *
     * @param newItems 추가할 항목
     * @return 추가 완료 Future
     */
    public CompletableFuture<Void> addRangeAsync(Collection<? extends T> newItems) {
        List<T> additions = copyOf(newItems);
        return mutate(() -> {
            if (additions.isEmpty()) {
                return null;
            }
            List<T> current = items;
            List<T> next = new ArrayList<>(current.size() + additions.size());
            next.addAll(current);
            next.addAll(additions);
            items = List.copyOf(next);
            notifyListeners(new CollectionChange<>(ChangeKind.ADD, additions, current.size(), items));
            return null;
        });
    }

    /**
     * 지정 위치에 항목 삽입.
     *
     * @param index 삽입 위치 (0 ~ size)
     * @param item 삽입할 항목
     * @return 삽입 완료 Future (index가 범위를 벗어나면 IndexOutOfBoundsException으로 완료)
     */
    public CompletableFuture<Void> insertAsync(int index, T item) {
        requireItem(item);
        return mutate(() -> {
            List<T> next = new ArrayList<>(items);
            next.add(index, item);
            items = List.copyOf(next);
            notifyListeners(new CollectionChange<>(ChangeKind.ADD, List.of(item), index, items));
            return null;
        });
    }

    /**
     * 첫 번째로 일치하는 항목 제거.
     *
     * @param item 제거할 항목
     * @return 제거 여부 Future (일치 항목이 없으면 false, 알림 없음)
     */
    public CompletableFuture<Boolean> removeAsync(T item) {
        requireItem(item);
        return mutate(() -> {
            List<T> current = items;
            int index = current.indexOf(item);
            if (index < 0) {
                return false;
            }
            List<T> next = new ArrayList<>(current);
            T removed = next.remove(index);
            items = List.copyOf(next);
            notifyListeners(new CollectionChange<>(ChangeKind.REMOVE, List.of(removed), index, items));
            return true;
        });
    }

    /**
     * 항목 위치 이동.
     *
     * @param oldIndex 현재 위치
     * @param newIndex 새 위치
     * @return 이동 완료 Future (index가 범위를 벗어나면 IndexOutOfBoundsException으로 완료)
     */
    public CompletableFuture<Void> moveAsync(int oldIndex, int newIndex) {
        return mutate(() -> {
            List<T> next = new ArrayList<>(items);
            T moved = next.remove(oldIndex);
            next.add(newIndex, moved);
            items = List.copyOf(next);
            notifyListeners(new CollectionChange<>(ChangeKind.MOVE, List.of(moved), newIndex, items));
            return null;
        });
    }

    /**
     * 전체 비움.
     *
     * @return 완료 Future
     */
    public CompletableFuture<Void> clearAsync() {
        return replaceAllAsync(List.of());
    }

    /**
     * 항목 수 조회.
     *
     * @return 항목 수
     */
    public int size() {
        return items.size();
    }

    /**
     * 비어 있는지 확인.
     *
     * @return 비어 있으면 true
     */
    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * index로 항목 조회.
     *
     * @param index 위치
     * @return 항목
     */
    public T get(int index) {
        return items.get(index);
    }

    /**
     * 현재 내용의 불변 스냅샷 조회.
     *
     * @return 불변 리스트
     */
    public List<T> snapshot() {
        return items;
    }

    @Override
    public Iterator<T> iterator() {
        return items.iterator();
    }

    /**
     * 변경 리스너 등록.
     *
     * @param listener 리스너
     */
    public void addChangeListener(CollectionChangeListener<T> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    /**
     * 변경 리스너 해제.
     *
     * @param listener 리스너
     */
    public void removeChangeListener(CollectionChangeListener<T> listener) {
        listeners.remove(listener);
    }

    private <R> CompletableFuture<R> mutate(Callable<R> mutation) {
        return dispatcher.callOrRun(() -> {
            // dispatcher may run callers inline on any thread
            synchronized (lock) {
                return mutation.call();
            }
        });
    }

    /**
     * 리스너 알림.
     *
     * <p>리스너 하나의 실패는 기록 후 나머지 리스너 알림을 계속합니다.
     * 변경 자체는 이미 적용된 상태입니다.</p>
     */
    private void notifyListeners(CollectionChange<T> change) {
        for (CollectionChangeListener<T> listener : listeners) {
            try {
                listener.onChanged(change);
            } catch (RuntimeException e) {
                log.error("Collection change listener failed for {} change", change.kind(), e);
            }
        }
    }

    private static <T> List<T> copyOf(Collection<? extends T> source) {
        if (source == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        for (T item : source) {
            requireItem(item);
        }
        return List.copyOf(source);
    }

    private static void requireItem(Object item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
    }
}
