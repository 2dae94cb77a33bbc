/**
 * Produce attempt stages.
 *
 * <p>{@link com.ryuqq.producer.core.stage.ProduceStage} tags every failed attempt so logs show
 * where the attempt broke (channel acquisition, encoding, reply queue setup or the send).</p>
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.core.stage;
