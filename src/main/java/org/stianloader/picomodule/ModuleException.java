package org.stianloader.picomodule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Unchecked exception used to carry a {@link FailureKind} through the internals of picomodule.
 * The public operations of {@link ModuleInstaller} and {@link org.stianloader.picomodule.publish.AssetVerifier}
 * never throw it, they convert it into a {@link Failure} value instead.
 *
 * <p>Archive and integrity failures carry the offending archive path or the expected and actual digests so that
 * a rejection can be audited without re-running the operation.
 */
public class ModuleException extends RuntimeException {

    private static final long serialVersionUID = 2718034537912620844L;

    @NotNull
    private final FailureKind kind;
    @Nullable
    private final String offendingPath;
    @Nullable
    private final String expected;
    @Nullable
    private final String actual;

    public ModuleException(@NotNull FailureKind kind, @NotNull String message) {
        this(kind, message, null, null, null, null);
    }

    public ModuleException(@NotNull FailureKind kind, @NotNull String message, @Nullable Throwable cause) {
        this(kind, message, null, null, null, cause);
    }

    public ModuleException(@NotNull FailureKind kind, @NotNull String message, @Nullable String offendingPath,
            @Nullable String expected, @Nullable String actual, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind may not be null");
        this.offendingPath = offendingPath;
        this.expected = expected;
        this.actual = actual;
    }

    @NotNull
    public static ModuleException forEntry(@NotNull FailureKind kind, @NotNull String message, @NotNull String entryName) {
        return new ModuleException(kind, message, entryName, null, null, null);
    }

    @NotNull
    public static ModuleException mismatch(@NotNull FailureKind kind, @NotNull String message, @NotNull String expected, @NotNull String actual) {
        return new ModuleException(kind, message, null, expected, actual, null);
    }

    /**
     * Obtain the {@link ModuleException} hidden behind a throwable, unwrapping {@link CompletionException},
     * {@link ExecutionException} and {@link UncheckedIOException} layers. Any other throwable is converted into
     * a {@link ModuleException} of the kind {@link FailureKind#IO_FAILURE}.
     *
     * @param t The throwable to inspect
     * @return The unwrapped or converted exception
     */
    @NotNull
    @Contract(pure = true)
    public static ModuleException unwrap(@NotNull Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof ModuleException) {
            return (ModuleException) current;
        }
        if (current instanceof UncheckedIOException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof IOException) {
            return new ModuleException(FailureKind.IO_FAILURE, String.valueOf(current.getMessage()), current);
        }
        return new ModuleException(FailureKind.IO_FAILURE, current.toString(), current);
    }

    @NotNull
    @Contract(pure = true)
    public FailureKind getKind() {
        return this.kind;
    }

    @Nullable
    @Contract(pure = true)
    public String getOffendingPath() {
        return this.offendingPath;
    }

    @Nullable
    @Contract(pure = true)
    public String getExpected() {
        return this.expected;
    }

    @Nullable
    @Contract(pure = true)
    public String getActual() {
        return this.actual;
    }

    @NotNull
    @Contract(pure = true)
    public Failure toFailure() {
        return new Failure(this.kind, String.valueOf(this.getMessage()), this.offendingPath, this.expected, this.actual);
    }
}
