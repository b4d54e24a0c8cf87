package com.tracebridge.collection.sink.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.tracebridge.collection.core.exporter.ExportResult;
import com.tracebridge.collection.sink.logging.autoconfigure.LoggingSinkAutoConfiguration;
import com.tracebridge.trace.model.Span;
import com.tracebridge.trace.model.SpanStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingSpanExporterTest {
    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingSpanExporter.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void logs_one_line_per_span() {
        Span span = Span.builder("Publish to RabbitMQ").build().start();
        span.addTag("queue", "webqueue");
        span.end(SpanStatus.ok());

        ExportResult result = new LoggingSinkAutoConfiguration().loggingSpanExporter().export(span);

        assertThat(result).isEqualTo(ExportResult.SUCCESS);
        assertThat(appender.list).singleElement().satisfies(e -> {
            assertThat(e.getFormattedMessage())
                    .contains("name=Publish to RabbitMQ")
                    .contains("traceId=" + span.traceId())
                    .contains("queue=webqueue");
        });
    }

    @Test
    void null_span_is_ignored() {
        assertThat(new LoggingSpanExporter().export(null)).isEqualTo(ExportResult.SUCCESS);
        assertThat(appender.list).isEmpty();
    }
}
