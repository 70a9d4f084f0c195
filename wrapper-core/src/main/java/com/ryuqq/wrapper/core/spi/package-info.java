/**
 * Service Provider Interfaces - combinator가 의존하는 외부 협력자.
 *
 * <h2>SPI 목록</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.core.spi.WorkerPool} - 작업 제출 (thread-safe)</li>
 *   <li>{@link com.ryuqq.wrapper.core.spi.CompletionHandle} - 작업 하나의 완료 핸들</li>
 *   <li>{@link com.ryuqq.wrapper.core.spi.MonotonicTimer} - 주입 가능한 단조 시계</li>
 * </ul>
 *
 * <h2>지원 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.core.spi.CompletionOrder} - 완료 순서대로 핸들 꺼내기</li>
 *   <li>{@link com.ryuqq.wrapper.core.spi.FutureCompletionHandle} - CompletableFuture 기반 핸들</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>명시적 주입:</strong> core는 프로세스 전역 pool을 숨겨두지 않음</li>
 *   <li><strong>취소 없음:</strong> 제출된 작업은 끝까지 실행됨</li>
 *   <li><strong>타임아웃 없음:</strong> 대상의 무한 대기는 그대로 무한 대기로 전파됨</li>
 * </ul>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.core.spi;
