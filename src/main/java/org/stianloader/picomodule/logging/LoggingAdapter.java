package org.stianloader.picomodule.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used by every component of picomodule.
 *
 * <p>Installing a module is something that happens inside of a larger application, which
 * usually already decided on a logging backend. picomodule therefore does not hard-depend on
 * SLF4J: if {@code org.slf4j.LoggerFactory} can be loaded, all messages are forwarded to SLF4J,
 * otherwise they end up in {@link java.util.logging.Logger java.util.logging}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Surplus arguments are appended to the message,
 * surplus placeholders are kept as-is. If the last argument is a {@link Throwable} that has no
 * placeholder of its own, its stacktrace is logged alongside the message.
 */
public abstract class LoggingAdapter {

    @NotNull
    static LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        LoggingAdapter.currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    /**
     * Replace the logger used by picomodule. Mostly useful for applications that want to
     * capture installer output in their own UI.
     *
     * @param instance The new default logger
     */
    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void error(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void info(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
