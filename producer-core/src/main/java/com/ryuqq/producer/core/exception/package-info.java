/**
 * Producer exceptions.
 *
 * <p>All exceptions are unchecked. {@link com.ryuqq.producer.core.exception.BrokerException} is what
 * channel adapters throw; {@link com.ryuqq.producer.core.exception.ProduceAttemptException} is what the
 * retry loop logs; {@link com.ryuqq.producer.core.exception.RetryExhaustedException} only surfaces when a
 * finite attempt budget is configured.</p>
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.core.exception;
