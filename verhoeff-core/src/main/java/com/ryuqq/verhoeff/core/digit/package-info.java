/**
 * ASCII digit parsing.
 *
 * @since 1.0.0
 * @author Verhoeff Team
 */
package com.ryuqq.verhoeff.core.digit;
