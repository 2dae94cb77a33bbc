/**
 * Logging transport backed by SLF4J.
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.runtime.transport;
