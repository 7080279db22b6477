package com.ryuqq.verhoeff.examples;

/**
 * 예제 실행 요약.
 *
 * @param demonstrations 실행한 시연 항목 수
 * @param unexpected 기대와 다른 결과가 나온 항목 수
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public record ExampleSummary(int demonstrations, int unexpected) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 음수이거나 unexpected가 demonstrations보다 큰 경우
     */
    public ExampleSummary {
        if (demonstrations < 0) {
            throw new IllegalArgumentException("demonstrations must be non-negative (current: " + demonstrations + ")");
        }
        if (unexpected < 0 || unexpected > demonstrations) {
            throw new IllegalArgumentException(
                "unexpected must be between 0 and " + demonstrations + " (current: " + unexpected + ")"
            );
        }
    }

    /**
     * 모든 항목이 기대대로 동작했는지 확인.
     *
     * @return unexpected가 0이면 true
     */
    public boolean allAsExpected() {
        return unexpected == 0;
    }
}
