package org.agentworld.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
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

/**
 * Fails a test when it logs at WARN or above (configurable with {@link FailOnLog}) unless the
 * event is covered by {@link AllowLog} or {@link ExpectLog}. Missing expected events fail too.
 * Allowed and expected events are suppressed from the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(final ExtensionContext context) {
        final CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(final ExtensionContext context) {
        final CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.clear();
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(final ExtensionContext context) {
        final CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        final Rules rules = filter.rules;
        final List<Captured> events = filter.snapshot();
        filter.clear();

        final List<String> problems = new ArrayList<>();
        if (!rules.disabled()) {
            for (final Captured event : events) {
                if (event.level().isGreaterOrEqual(toLogback(rules.minLevel())) && !rules.permits(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (final ExpectLog expected : rules.expects()) {
            final long count = events.stream().filter(e -> matches(e, expected.level(), expected.loggerPattern(), expected.messagePattern())).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                    expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(final ExtensionContext context) {
        final CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(final ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(final ExtensionContext context) {
        final Optional<Class<?>> testClass = context.getTestClass();
        final Optional<AnnotatedElement> element = context.getElement();
        final FailOnLog fail = element.map(e -> e.getAnnotation(FailOnLog.class))
            .orElseGet(() -> testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));

        final List<AllowLog> allows = new ArrayList<>();
        final List<ExpectLog> expects = new ArrayList<>();
        testClass.ifPresent(c -> {
            allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
        });
        // at class level the element is the class itself
        element.filter(e -> !(e instanceof Class<?>)).ifPresent(e -> {
            allows.addAll(List.of(e.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(e.getAnnotationsByType(ExpectLog.class)));
        });
        return new Rules(fail != null ? fail.level() : LogLevel.WARN, fail != null && fail.disabled(),
            List.copyOf(allows), List.copyOf(expects));
    }

    private static boolean matches(final Captured event, final LogLevel level, final String loggerPattern, final String messagePattern) {
        return event.level().isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, event.loggerName())
            && Pattern.matches(messagePattern, event.message());
    }

    private static Level toLogback(final LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        boolean permits(final Captured event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                || expects.stream().anyMatch(x -> matches(event, x.level(), x.loggerPattern(), x.messagePattern()));
        }
    }

    private record Captured(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Captured> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(final Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(final Marker marker, final Logger logger, final Level level, final String format,
                                  final Object[] params, final Throwable t) {
            // isEnabled checks arrive without a format
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            final Captured event = new Captured(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Captured> snapshot() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }
}
