/**
 * Generic Decorator Builder.
 *
 * <p>평범한 {@code (target, invocation) -> result} 함수를
 * bare 또는 configured 형태로 쓸 수 있는 데코레이터로 바꿉니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.core.decorator.DecoratorBody} - 데코레이터 본문</li>
 *   <li>{@link com.ryuqq.wrapper.core.decorator.DecoratorFactory} - bare/configured 생성 및 동적 판정</li>
 *   <li>{@link com.ryuqq.wrapper.core.decorator.ConfiguredDecorator} - 설정 인자가 고정된 데코레이터</li>
 *   <li>{@link com.ryuqq.wrapper.core.decorator.DecoratorApplication} - 동적 판정 결과 (sealed)</li>
 * </ul>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.core.decorator;
