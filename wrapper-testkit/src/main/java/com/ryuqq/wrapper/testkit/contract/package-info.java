/**
 * SPI 계약 테스트.
 *
 * <p>구현체 모듈의 테스트가 상속하여 같은 계약 시나리오를 재사용합니다.</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.testkit.contract;
