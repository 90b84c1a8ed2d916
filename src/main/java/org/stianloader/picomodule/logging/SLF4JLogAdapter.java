package org.stianloader.picomodule.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class SLF4JLogAdapter extends LoggingAdapter {

    @NotNull
    private static Logger logger(@NotNull Class<?> clazz) {
        return LoggerFactory.getLogger(clazz);
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        Logger logger = SLF4JLogAdapter.logger(clazz);
        if (logger.isDebugEnabled()) {
            logger.debug(message, args);
        }
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        SLF4JLogAdapter.logger(clazz).error(message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        SLF4JLogAdapter.logger(clazz).info(message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        SLF4JLogAdapter.logger(clazz).warn(message, args);
    }
}
