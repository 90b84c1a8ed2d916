package org.stianloader.picomodule;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of an update.
 *
 * @param success Whether the update completed; an update that found nothing to do is successful
 * @param oldVersion The version recorded before the update
 * @param newVersion The version installed by the update
 * @param upToDate True if the installed version already was the latest one and nothing was changed
 * @param failure Why the update failed, null on success
 */
public final record UpdateResult(boolean success, @Nullable String oldVersion, @Nullable String newVersion, boolean upToDate, @Nullable Failure failure) {

    @NotNull
    static UpdateResult failed(@Nullable String oldVersion, @NotNull Failure failure) {
        return new UpdateResult(false, oldVersion, null, false, failure);
    }
}
