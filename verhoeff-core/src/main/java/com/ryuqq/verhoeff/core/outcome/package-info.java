/**
 * Result type of the strict API.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.verhoeff.core.outcome.Result} - Sealed interface (permits Success, Failure)</li>
 * </ul>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.verhoeff.core.outcome.Success} - Value computed</li>
 *   <li>{@link com.ryuqq.verhoeff.core.outcome.Failure} - Malformed input, carries the {@code VerhoeffError}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Verhoeff Team
 */
package com.ryuqq.verhoeff.core.outcome;
