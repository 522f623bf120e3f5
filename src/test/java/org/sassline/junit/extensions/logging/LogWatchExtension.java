package org.sassline.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test that logs at or above the {@link FailOnLog} level (WARN by default) unless
 * the event is announced with {@link AllowLog} or {@link ExpectLog}, and fails a test that
 * does not log what its {@link ExpectLog} annotations require.
 * <p>
 * Events are captured with a Logback turbo filter, so they are seen even when the
 * logger's configured level would discard them. Announced events are not printed.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.of(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : filter.events) {
                if (event.level.isGreaterOrEqual(toLogback(rules.failLevel)) && !rules.announced(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expected : rules.expects) {
            long count = filter.events.stream().filter(e -> matches(e, expected.level(), expected.loggerPattern(), expected.messagePattern())).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName)
                && Pattern.matches(messagePattern, event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(LogLevel failLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        static Rules of(ExtensionContext context) {
            Optional<FailOnLog> fail = context.getTestMethod()
                    .map(m -> m.getAnnotation(FailOnLog.class))
                    .or(() -> context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)));
            return new Rules(
                    fail.map(FailOnLog::level).orElse(LogLevel.WARN),
                    fail.map(FailOnLog::disabled).orElse(false),
                    collect(context, AllowLog.class),
                    collect(context, ExpectLog.class));
        }

        private static <A extends java.lang.annotation.Annotation> List<A> collect(ExtensionContext context, Class<A> type) {
            Stream<AnnotatedElement> elements = Stream.concat(context.getTestClass().stream(), context.getTestMethod().stream());
            return elements.flatMap(e -> Stream.of(e.getAnnotationsByType(type))).toList();
        }

        Level captureLevel() {
            Level lowest = toLogback(failLevel);
            for (AllowLog allow : allows) {
                lowest = lower(lowest, toLogback(allow.level()));
            }
            for (ExpectLog expect : expects) {
                lowest = lower(lowest, toLogback(expect.level()));
            }
            return lowest;
        }

        private static Level lower(Level a, Level b) {
            return a.isGreaterOrEqual(b) ? b : a;
        }

        boolean announced(Event event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static class CapturingFilter extends TurboFilter {
        private final Rules rules;
        private final Level captureLevel;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
            this.captureLevel = rules.captureLevel();
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (level == null || format == null || !level.isGreaterOrEqual(captureLevel)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.announced(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
