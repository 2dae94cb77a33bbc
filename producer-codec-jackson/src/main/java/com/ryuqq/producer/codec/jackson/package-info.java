/**
 * Jackson implementation of the message codec SPI.
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.codec.jackson;
