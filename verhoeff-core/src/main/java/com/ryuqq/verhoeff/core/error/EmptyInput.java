package com.ryuqq.verhoeff.core.error;

/**
 * 빈 입력.
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public record EmptyInput() implements VerhoeffError {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "VERHOEFF-002";

    @Override
    public String errorCode() {
        return ERROR_CODE;
    }

    @Override
    public String message() {
        return "Input cannot be empty";
    }
}
