package org.structura.junit.extensions.logging;

import ch.qos.logback.classic.Level;
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
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test that logs at WARN or above unless the event is covered by {@link AllowLog} or
 * {@link ExpectLog}, and fails it when an {@link ExpectLog} is not met.
 * <p>
 * One turbo filter is installed per test class and re-armed with the method's rules before each
 * test; captured events are cleared after each test so nothing leaks between tests. Allowed and
 * expected events are swallowed so they do not clutter the build output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.clearEvents();
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<CapturedEvent> events = filter.events();
        filter.clearEvents();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled()) {
            for (CapturedEvent e : events) {
                if (e.level().isGreaterOrEqual(toLogback(rules.failLevel())) && !rules.covers(e)) {
                    unexpected.add(e.toString());
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (ExpectLog expect : rules.expects()) {
            long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                missing.add(String.format("expected %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            if (!unexpected.isEmpty()) {
                sb.append("Unexpected logs:\n");
                unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            if (!missing.isEmpty()) {
                sb.append("Missing expected logs:\n");
                missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            throw new AssertionError(sb.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        return new Rules(
                fail != null ? fail.level() : LogLevel.WARN,
                fail != null && fail.disabled(),
                collect(context, el -> el.getAnnotationsByType(AllowLog.class)),
                collect(context, el -> el.getAnnotationsByType(ExpectLog.class)));
    }

    /**
     * Class-level annotations first, then those on the test method.
     */
    private static <A> List<A> collect(ExtensionContext context, Function<AnnotatedElement, A[]> lookup) {
        List<A> result = new ArrayList<>();
        context.getTestClass().ifPresent(c -> result.addAll(Arrays.asList(lookup.apply(c))));
        context.getTestMethod().ifPresent(m -> result.addAll(Arrays.asList(lookup.apply(m))));
        return result;
    }

    private static boolean matches(CapturedEvent e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level().isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, e.loggerName())
                && Pattern.matches(messagePattern, e.message());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(LogLevel failLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        boolean covers(CapturedEvent e) {
            return allows.stream().anyMatch(a -> matches(e, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(x -> matches(e, x.level(), x.loggerPattern(), x.messagePattern()));
        }

        /**
         * Lowest level any rule looks at; an INFO expectation needs INFO events captured.
         */
        Level captureLevel() {
            return Stream.concat(
                            Stream.of(failLevel),
                            expects.stream().map(ExpectLog::level))
                    .map(LogWatchExtension::toLogback)
                    .min((a, b) -> Integer.compare(a.toInt(), b.toInt()))
                    .orElse(Level.WARN);
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            Rules current = rules;
            // a null format is an isXxxEnabled() probe, not an event
            if (format == null || level == null || !level.isGreaterOrEqual(current.captureLevel())) {
                return FilterReply.NEUTRAL;
            }
            if (!level.isGreaterOrEqual(logger.getEffectiveLevel())) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            CapturedEvent event = new CapturedEvent(logger.getName(), level, message != null ? message : "");
            events.add(event);
            return current.covers(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<CapturedEvent> events() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }
    }
}
