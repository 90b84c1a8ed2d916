package org.stianloader.picomodule.publish;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.Failure;

/**
 * The outcome of {@link AssetVerifier#verify(VerifyOptions, java.util.concurrent.Executor)}.
 *
 * @param ok True if every module passed
 * @param checked The amount of modules checked
 * @param passed The amount of modules that passed
 * @param failed The amount of modules that failed
 * @param failures The failed modules, in index order
 * @param indexFailure Set if the index itself could not be obtained, in which case no module was checked
 */
public final record VerifyResult(boolean ok, int checked, int passed, int failed, @NotNull List<VerifyFailure> failures, @Nullable Failure indexFailure) {

    public VerifyResult {
        failures = List.copyOf(failures);
    }

    @NotNull
    static VerifyResult ofIndexFailure(@NotNull Failure failure) {
        return new VerifyResult(false, 0, 0, 0, List.of(), failure);
    }
}
