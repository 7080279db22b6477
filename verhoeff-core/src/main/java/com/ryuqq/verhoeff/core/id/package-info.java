/**
 * Fixed-length ID validation.
 *
 * <ul>
 *   <li>{@link com.ryuqq.verhoeff.core.id.FixedLengthIdConfig} - Immutable configuration (name, required length)</li>
 *   <li>{@link com.ryuqq.verhoeff.core.id.FixedLengthIdValidator} - Length check, then checksum comparison</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Verhoeff Team
 */
package com.ryuqq.verhoeff.core.id;
