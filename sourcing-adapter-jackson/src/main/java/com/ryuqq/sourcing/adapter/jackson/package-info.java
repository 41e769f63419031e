/**
 * Jackson serialization adapter.
 *
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.adapter.jackson.JacksonPayloadCodec} - lenient JSON codec</li>
 *   <li>{@link com.ryuqq.sourcing.adapter.jackson.EventStoreSeeder} - JSON event seeding</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
package com.ryuqq.sourcing.adapter.jackson;
