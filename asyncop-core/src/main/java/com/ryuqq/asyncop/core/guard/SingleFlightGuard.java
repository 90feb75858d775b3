package com.ryuqq.asyncop.core.guard;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 논블로킹 Single-Flight Guard.
 *
 * <p>하나의 논리적 load 경로에서 동시에 최대 한 개의 실행만 허용합니다.
 * 진입에 실패한 호출자는 대기열에 들어가지 않고 작업 전체를 건너뛰어야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Optional<SingleFlightGuard.Permit> permit = guard.tryAcquire();
 * if (permit.isEmpty()) {
 *     log.info("load already in progress, skipping duplicate request");
 *     return;
 * }
 * try (SingleFlightGuard.Permit ignored = permit.get()) {
 *     // 실패하거나 취소되어도 close()에서 release됨
 * }
 * }</pre>
 *
 * <p>이 guard는 "동시에 하나만 실행" 불변식만 보호합니다. 같은 컬렉션을 서로 다른 guard로
 * 보호되는 두 경로에서 동시에 변경하는 경우의 충돌은 호출자 책임입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SingleFlightGuard {

    private final String name;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @param name guard 이름 (로그 및 진단용)
     * @throws IllegalArgumentException name이 null 또는 blank인 경우
     */
    public SingleFlightGuard(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    /**
     * 진입 시도 (논블로킹).
     *
     * @return 진입에 성공한 경우 true, 이미 실행 중인 경우 false
     */
    public boolean tryEnter() {
        return inFlight.compareAndSet(false, true);
    }

    /**
     * 진입 해제.
     *
     * <p>성공한 {@link #tryEnter()}마다 정확히 한 번 호출되어야 합니다.</p>
     *
     * @throws IllegalStateException 진입하지 않은 상태에서 호출된 경우
     */
    public void release() {
        if (!inFlight.compareAndSet(true, false)) {
            throw new IllegalStateException("release() called without a matching tryEnter() on guard: " + name);
        }
    }

    /**
     * 진입 시도 후 scoped permit 반환.
     *
     * @return 진입 성공 시 Permit, 실패 시 empty
     */
    public Optional<Permit> tryAcquire() {
        return tryEnter() ? Optional.of(new Permit()) : Optional.empty();
    }

    /**
     * 실행 중 여부 확인.
     *
     * @return 진입한 호출자가 있는 경우 true
     */
    public boolean isInFlight() {
        return inFlight.get();
    }

    /**
     * guard 이름 조회.
     *
     * @return guard 이름
     */
    public String getName() {
        return name;
    }

    /**
     * try-with-resources용 진입 permit.
     *
     * <p>close()는 여러 번 호출되어도 guard를 한 번만 해제합니다.</p>
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
