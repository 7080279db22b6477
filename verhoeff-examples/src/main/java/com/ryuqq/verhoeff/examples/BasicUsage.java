package com.ryuqq.verhoeff.examples;

/**
 * 예제 실행 진입점.
 *
 * <p>기대와 다른 결과가 하나라도 있으면 종료 코드 1로 끝납니다.</p>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public final class BasicUsage {

    private BasicUsage() {
    }

    public static void main(String[] args) {
        ExampleSummary summary = new ExampleRunner(new Slf4jReportWriter()).run();
        if (!summary.allAsExpected()) {
            System.exit(1);
        }
    }
}
