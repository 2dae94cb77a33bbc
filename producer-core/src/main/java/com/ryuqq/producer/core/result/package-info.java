/**
 * Produce 결과 타입.
 *
 * <ul>
 *   <li>{@link com.ryuqq.producer.core.result.Sent} - 일반 전송 완료</li>
 *   <li>{@link com.ryuqq.producer.core.result.Replied} - RPC 응답 수신 완료</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.core.result;
