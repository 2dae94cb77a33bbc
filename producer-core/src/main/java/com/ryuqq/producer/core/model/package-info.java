/**
 * Core value objects identifying where messages go and how replies are matched.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.producer.core.model.Destination} - Queue or exchange a message is sent to</li>
 *   <li>{@link com.ryuqq.producer.core.model.CorrelationId} - Token linking an RPC request to its reply</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.core.model;
