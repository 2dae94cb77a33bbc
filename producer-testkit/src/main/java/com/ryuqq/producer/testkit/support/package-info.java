/**
 * Test doubles shared by contract tests: recording transport and delayer, and an in-memory
 * RPC responder.
 *
 * @since 1.0.0
 * @author Producer Team
 */
package com.ryuqq.producer.testkit.support;
