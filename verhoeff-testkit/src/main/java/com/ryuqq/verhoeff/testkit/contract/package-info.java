/**
 * Contract test support for the Verhoeff error-detection guarantees.
 *
 * <p>{@link com.ryuqq.verhoeff.testkit.contract.AbstractDetectionContractTest} gives JUnit 5
 * tests a fresh engine and mutation helpers for substitution and transposition errors.</p>
 *
 * @since 1.0.0
 * @author Verhoeff Team
 */
package com.ryuqq.verhoeff.testkit.contract;
