/**
 * Checksum computation and validation.
 *
 * <p>{@link com.ryuqq.verhoeff.core.engine.ChecksumEngine} folds a digit sequence right to left
 * through the D and P tables. Computation shifts every permutation position by one and inverts
 * the final value; validation uses the unshifted positions and accepts a final value of zero.</p>
 *
 * @since 1.0.0
 * @author Verhoeff Team
 */
package com.ryuqq.verhoeff.core.engine;
