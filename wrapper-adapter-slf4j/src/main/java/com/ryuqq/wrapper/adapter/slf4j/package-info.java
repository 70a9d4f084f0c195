/**
 * SLF4J Adapter - DiagnosticSink 구현체.
 *
 * <p>표준 스트림 대신 애플리케이션 로깅 설정을 따르도록 진단 출력을 SLF4J로 보냅니다.</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.adapter.slf4j;
