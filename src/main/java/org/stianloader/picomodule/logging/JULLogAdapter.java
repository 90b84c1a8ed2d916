package org.stianloader.picomodule.logging;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    static String format(@NotNull String message, Object @NotNull... args) {
        StringBuilder out = new StringBuilder(message.length() + 16 * args.length);
        int cursor = 0;
        int consumed = 0;
        while (consumed < args.length) {
            int placeholder = message.indexOf("{}", cursor);
            if (placeholder == -1) {
                break;
            }
            out.append(message, cursor, placeholder).append(Objects.toString(args[consumed++]));
            cursor = placeholder + 2;
        }
        out.append(message, cursor, message.length());
        int trailing = JULLogAdapter.trailingThrowable(args) == null ? args.length : args.length - 1;
        for (; consumed < trailing; consumed++) {
            out.append(' ').append(Objects.toString(args[consumed]));
        }
        return out.toString();
    }

    @Nullable
    private static Throwable trailingThrowable(Object @NotNull[] args) {
        if (args.length != 0 && args[args.length - 1] instanceof Throwable) {
            return (Throwable) args[args.length - 1];
        }
        return null;
    }

    private static void log(@NotNull Class<?> clazz, @NotNull Level level, @NotNull String message, Object @NotNull[] args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (!logger.isLoggable(level)) {
            return;
        }
        LogRecord record = new LogRecord(level, JULLogAdapter.format(message, args));
        record.setLoggerName(logger.getName());
        record.setSourceClassName(clazz.getName());
        Throwable thrown = JULLogAdapter.trailingThrowable(args);
        if (thrown != null && JULLogAdapter.countPlaceholders(message) < args.length) {
            record.setThrown(thrown);
        }
        logger.log(record);
    }

    private static int countPlaceholders(@NotNull String message) {
        int count = 0;
        for (int i = message.indexOf("{}"); i != -1; i = message.indexOf("{}", i + 2)) {
            count++;
        }
        return count;
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
