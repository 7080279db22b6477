/**
 * Error taxonomy surfaced to callers.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.verhoeff.core.error.VerhoeffError} - Sealed interface (permits InvalidCharacter, EmptyInput, InvalidLength)</li>
 * </ul>
 *
 * <h2>Error Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.verhoeff.core.error.InvalidCharacter} - VERHOEFF-001, offending character and position</li>
 *   <li>{@link com.ryuqq.verhoeff.core.error.EmptyInput} - VERHOEFF-002</li>
 *   <li>{@link com.ryuqq.verhoeff.core.error.InvalidLength} - VERHOEFF-003, expected vs. actual length</li>
 * </ul>
 *
 * <p>Errors are values. {@link com.ryuqq.verhoeff.core.error.VerhoeffException} exists only for
 * callers who opt into exceptions through {@code Result.orElseThrow()}.</p>
 *
 * @since 1.0.0
 * @author Verhoeff Team
 */
package com.ryuqq.verhoeff.core.error;
