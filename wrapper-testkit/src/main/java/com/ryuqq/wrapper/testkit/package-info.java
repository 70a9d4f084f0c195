/**
 * Testkit - combinator와 SPI 구현체 테스트 지원.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.testkit.FakeTimer} - 결정적 가짜 시계</li>
 *   <li>{@link com.ryuqq.wrapper.testkit.RecordingDiagnosticSink} - 보고 내용 기록</li>
 *   <li>{@link com.ryuqq.wrapper.testkit.CountingInvocable} - 호출 횟수 기록</li>
 *   <li>{@link com.ryuqq.wrapper.testkit.InlineWorkerPool} - 호출 스레드 즉시 실행 pool</li>
 *   <li>{@link com.ryuqq.wrapper.testkit.contract.AbstractWorkerPoolContractTest} - WorkerPool 계약 테스트</li>
 * </ul>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.testkit;
