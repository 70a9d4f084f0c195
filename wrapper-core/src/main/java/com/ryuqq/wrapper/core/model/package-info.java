/**
 * Call-scoped value types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.wrapper.core.model.Invocation} - 한 번의 호출 인자 (위치 + 이름)</li>
 * </ul>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.core.model;
