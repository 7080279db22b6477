package com.ryuqq.verhoeff.examples;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J INFO 레벨로 출력하는 {@link ReportWriter}.
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public final class Slf4jReportWriter implements ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(Slf4jReportWriter.class);

    @Override
    public void section(String title) {
        log.info("");
        log.info("{}", title);
    }

    @Override
    public void line(String text) {
        log.info("   {}", text);
    }
}
