package org.stianloader.picomodule.repo;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;

/**
 * A file that was streamed to disk by {@link HttpTransport#download(java.net.URI, Path, long, long, String)}.
 *
 * @param path The location of the downloaded file
 * @param size The amount of bytes written
 * @param sha256 The lowercase hex sha256 digest of the written bytes, computed while they were streamed
 */
public final record DownloadedFile(@NotNull Path path, long size, @NotNull String sha256) {
}
