/**
 * Verhoeff check digit SDK entry point.
 *
 * <p>{@link com.ryuqq.verhoeff.core.Verhoeff} exposes the public operations in two forms:
 * a strict form returning {@link com.ryuqq.verhoeff.core.outcome.Result} and a permissive
 * form that collapses every error into a fixed default.</p>
 *
 * <h2>Packages</h2>
 * <ul>
 *   <li>{@code table} - Immutable D, P and INV lookup tables</li>
 *   <li>{@code digit} - ASCII digit parser and parsed sequence</li>
 *   <li>{@code engine} - Checksum computation and validation</li>
 *   <li>{@code id} - Fixed-length ID validation (Aadhaar, 12 digits)</li>
 *   <li>{@code outcome} - Result type</li>
 *   <li>{@code error} - Error taxonomy</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Purity:</strong> Every operation is a pure function of its input</li>
 *   <li><strong>Thread Safety:</strong> No shared mutable state; tables are read-only constants</li>
 *   <li><strong>Pure Java:</strong> No external dependencies, no logging</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Verhoeff Team
 */
package com.ryuqq.verhoeff.core;
