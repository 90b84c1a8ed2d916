package org.stianloader.picomodule;

import org.jetbrains.annotations.Nullable;

public final record RemoveResult(boolean success, @Nullable Failure failure) {
}
