/**
 * RPC 응답 큐 레지스트리.
 *
 * <p>{@link com.ryuqq.producer.runtime.registry.ResponseQueueRegistry}는 연결 수명에 묶인 명시적 객체로,
 * producer에 주입됩니다. 전역 상태를 두지 않아 테스트 간 상태 누수가 없습니다.</p>
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.runtime.registry;
