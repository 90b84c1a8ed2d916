package org.stianloader.picomodule.publish;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;

/**
 * A module that failed release verification.
 *
 * @param module The key of the module in the index
 * @param phase The phase the module failed in
 * @param tarballRef The tarball reference as written in the index
 * @param tarballResolved The tarball location after resolving it against the index or the assets directory
 * @param message What went wrong
 * @param kind The kind of the failure
 */
public final record VerifyFailure(@NotNull String module, @NotNull VerifyPhase phase, @Nullable String tarballRef,
        @Nullable String tarballResolved, @NotNull String message, @NotNull FailureKind kind) {
}
