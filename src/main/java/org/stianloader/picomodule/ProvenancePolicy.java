package org.stianloader.picomodule;

/**
 * How strictly the installer treats the provenance of the modules it installs.
 */
public enum ProvenancePolicy {
    /**
     * Any source is accepted. A provenance record is written where possible, failing to do so is logged but
     * does not fail the installation.
     */
    BEST_EFFORT,

    /**
     * Only checksum-verified registry tarballs are accepted, and the installation fails if its provenance
     * record cannot be written.
     */
    REQUIRED;
}
