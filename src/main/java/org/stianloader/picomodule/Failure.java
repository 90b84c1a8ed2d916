package org.stianloader.picomodule;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A failed operation, as reported to callers of picomodule.
 *
 * @param kind The kind of the failure
 * @param message A human readable message
 * @param path The offending archive member or file, if any
 * @param expected The expected digest or size, if the failure is an integrity failure
 * @param actual The observed digest or size, if the failure is an integrity failure
 */
public final record Failure(@NotNull FailureKind kind, @NotNull String message, @Nullable String path,
        @Nullable String expected, @Nullable String actual) {

    @NotNull
    public static Failure of(@NotNull FailureKind kind, @NotNull String message) {
        return new Failure(kind, message, null, null, null);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder().append(this.kind).append(": ").append(this.message);
        if (this.path != null) {
            builder.append(" [path: ").append(this.path).append(']');
        }
        if (this.expected != null || this.actual != null) {
            builder.append(" [expected: ").append(this.expected).append(", actual: ").append(this.actual).append(']');
        }
        return builder.toString();
    }
}
