package org.stianloader.picomodule.internal;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;

/**
 * An {@link InputStream} that fails as soon as more than a fixed amount of bytes was read through it.
 * The check happens on every read, so the ceiling holds regardless of what the producer of the bytes
 * claimed beforehand.
 */
public class BoundedInputStream extends FilterInputStream {

    private final long limit;
    @NotNull
    private final FailureKind kind;
    @NotNull
    private final String description;
    private long count;

    public BoundedInputStream(@NotNull InputStream in, long limit, @NotNull FailureKind kind, @NotNull String description) {
        super(in);
        if (limit < 0) {
            throw new IllegalArgumentException("limit may not be negative");
        }
        this.limit = limit;
        this.kind = kind;
        this.description = description;
    }

    private void consumed(long amount) {
        if (amount <= 0) {
            return;
        }
        this.count += amount;
        if (this.count > this.limit) {
            throw new ModuleException(this.kind, this.description + " exceeds the limit of " + this.limit + " bytes (read at least " + this.count + " bytes)");
        }
    }

    public long getCount() {
        return this.count;
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b != -1) {
            this.consumed(1);
        }
        return b;
    }

    @Override
    public int read(byte @NotNull[] b, int off, int len) throws IOException {
        int read = super.read(b, off, len);
        this.consumed(read);
        return read;
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = super.skip(n);
        this.consumed(skipped);
        return skipped;
    }

    @Override
    public boolean markSupported() {
        return false;
    }
}
