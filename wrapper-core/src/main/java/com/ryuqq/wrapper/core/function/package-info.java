/**
 * 호출 대상과 Call Wrapper 골격.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.core.function.Invocable} - 감쌀 수 있는 호출 대상</li>
 *   <li>{@link com.ryuqq.wrapper.core.function.CallWrapper} - 정책을 적용하는 wrapper 골격</li>
 *   <li>{@link com.ryuqq.wrapper.core.function.Decorator} - 시그니처 보존 combinator</li>
 * </ul>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.core.function;
