package org.stianloader.picomodule.publish;

import java.util.Locale;

import org.jetbrains.annotations.NotNull;

/**
 * The stage of release verification a module failed in.
 */
public enum VerifyPhase {
    DOWNLOAD,
    CHECKSUM,
    EXTRACT;

    /**
     * The lower case name used in reports, e.g. {@code checksum}.
     *
     * @return The report name of the phase
     */
    @NotNull
    public String getReportName() {
        return this.name().toLowerCase(Locale.ROOT);
    }
}
