/**
 * Combinator 구현체.
 *
 * <h2>Combinator 목록</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.core.combinator.Repeat} - 순차 n회 반복, 마지막 결과 반환</li>
 *   <li>{@link com.ryuqq.wrapper.core.combinator.ThreadedRepeat} - WorkerPool에 n회 동시 제출, 마지막 완료 결과 반환</li>
 *   <li>{@link com.ryuqq.wrapper.core.combinator.Catch} - 설정된 예외 억제 + handler/sink 라우팅</li>
 *   <li>{@link com.ryuqq.wrapper.core.combinator.TimeIt} - 실행 시간 측정 및 보고</li>
 * </ul>
 *
 * <h2>예외 분류</h2>
 * <ul>
 *   <li><strong>전파:</strong> Catch에 일치하지 않는 모든 예외는 변형 없이 호출자에게 전달</li>
 *   <li><strong>억제:</strong> Catch에 일치한 예외는 Suppressed 결과 + 진단 보고 (silent가 아니면)</li>
 *   <li><strong>설정 오류:</strong> 잘못된 정책 값은 생성 시점에 IllegalArgumentException</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>Stateless:</strong> 호출 간 상태 없음, 자체 lock 없음</li>
 *   <li><strong>중복 보고 없음:</strong> handler로 보낸 예외는 sink로 다시 보내지 않음</li>
 * </ul>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.core.combinator;
