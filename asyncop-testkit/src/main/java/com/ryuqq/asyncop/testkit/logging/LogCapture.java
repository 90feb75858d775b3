package com.ryuqq.asyncop.testkit.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 특정 Logger의 로그 이벤트를 수집하는 테스트 헬퍼.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (LogCapture capture = LogCapture.attach(RetryPolicy.class)) {
 *     loader.load();
 *     assertThat(capture.count(Level.WARN)).isEqualTo(2);
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LogCapture implements AutoCloseable {

    private final Logger logger;
    private final ListAppender<ILoggingEvent> appender;

    private LogCapture(Logger logger) {
        this.logger = logger;
        this.appender = new ListAppender<>();
        this.appender.list = new CopyOnWriteArrayList<>();
        this.appender.start();
        this.logger.addAppender(appender);
    }

    public static LogCapture attach(Class<?> type) {
        return new LogCapture((Logger) LoggerFactory.getLogger(type));
    }

    public static LogCapture attach(String loggerName) {
        return new LogCapture((Logger) LoggerFactory.getLogger(loggerName));
    }

    /**
     * 레벨별 이벤트 수.
     *
     * @param level 로그 레벨
     * @return 이벤트 수
     */
    public long count(Level level) {
        return appender.list.stream().filter(event -> event.getLevel() == level).count();
    }

    /**
     * 레벨별 포맷된 메시지.
     *
     * @param level 로그 레벨
     * @return 메시지 목록 (기록 순서)
     */
    public List<String> messages(Level level) {
        return appender.list.stream()
            .filter(event -> event.getLevel() == level)
            .map(ILoggingEvent::getFormattedMessage)
            .toList();
    }

    public List<ILoggingEvent> events() {
        return List.copyOf(appender.list);
    }

    @Override
    public void close() {
        logger.detachAppender(appender);
        appender.stop();
    }
}
