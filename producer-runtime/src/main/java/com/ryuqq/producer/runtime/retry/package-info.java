/**
 * 재시도 정책과 대기 유틸리티.
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.runtime.retry;
