/**
 * Contract test base for producer scenarios on the in-memory broker.
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.testkit.contract;
