package com.ryuqq.wrapper.adapter.executor;

/**
 * ExecutorServiceWorkerPool 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threads: worker 스레드 수 (기본 0 = 상한 없는 cached pool)</li>
 *   <li>threadNamePrefix: worker 스레드 이름 접두사 (기본 "wrapper-worker")</li>
 *   <li>daemon: daemon 스레드 여부 (기본 true, JVM 종료를 막지 않음)</li>
 *   <li>shutdownTimeoutMs: close() 시 graceful 종료 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>짧은 I/O 대기 위주: threads=0 (cached)</li>
 *   <li>CPU 위주 또는 동시 호출 수 제한 필요: threads = 코어 수</li>
 * </ul>
 *
 * @author Wrapper Team
 * @since 1.0.0
 * @param threads worker 스레드 수 (0이면 cached, 음수 불가)
 * @param threadNamePrefix 스레드 이름 접두사 (blank 불가)
 * @param daemon daemon 스레드 여부
 * @param shutdownTimeoutMs graceful 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record WorkerPoolConfig(
    int threads,
    String threadNamePrefix,
    boolean daemon,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threads=0 (cached), threadNamePrefix="wrapper-worker", daemon=true, shutdownTimeoutMs=60000ms</p>
     */
    public WorkerPoolConfig() {
        this(0, "wrapper-worker", true, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerPoolConfig {
        if (threads < 0) {
            throw new IllegalArgumentException(
                "threads must be non-negative (current: " + threads + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * 고정 크기 pool 여부.
     *
     * @return threads가 1 이상이면 true
     */
    public boolean isBounded() {
        return threads > 0;
    }

    /**
     * threads만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withThreads(int threads) {
        return new WorkerPoolConfig(threads, threadNamePrefix, daemon, shutdownTimeoutMs);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withThreadNamePrefix(String threadNamePrefix) {
        return new WorkerPoolConfig(threads, threadNamePrefix, daemon, shutdownTimeoutMs);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withDaemon(boolean daemon) {
        return new WorkerPoolConfig(threads, threadNamePrefix, daemon, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new WorkerPoolConfig(threads, threadNamePrefix, daemon, shutdownTimeoutMs);
    }
}
