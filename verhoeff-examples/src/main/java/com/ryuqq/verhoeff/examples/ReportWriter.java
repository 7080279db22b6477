package com.ryuqq.verhoeff.examples;

/**
 * 예제 출력 대상.
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public interface ReportWriter {

    /**
     * 새 섹션 시작.
     *
     * @param title 섹션 제목
     */
    void section(String title);

    /**
     * 섹션 내 한 줄 출력.
     *
     * @param text 내용
     */
    void line(String text);
}
