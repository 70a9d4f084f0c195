/**
 * 진단 출력 채널 (side-channel).
 *
 * <p>예외 trace와 실행 시간 보고는 core 계약의 일부가 아니라 주입 가능한 협력자입니다.
 * 각 combinator의 handler 파라미터로 대체할 수 있습니다.</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.core.diagnostic;
