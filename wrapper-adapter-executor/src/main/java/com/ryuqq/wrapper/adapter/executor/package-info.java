/**
 * ExecutorService Adapter - WorkerPool 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.adapter.executor.ExecutorServiceWorkerPool} - fixed/cached ExecutorService 기반 pool</li>
 *   <li>{@link com.ryuqq.wrapper.adapter.executor.DefaultWorkerPool} - lazy 생성 공용 pool</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-executor (ExecutorServiceWorkerPool)
 *   ↓ implements
 * core/spi (WorkerPool, CompletionHandle)
 *   ↑ used by
 * core/combinator (ThreadedRepeat)
 * </pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.adapter.executor;
