package org.stianloader.picomodule;

/**
 * The kind of a failure raised while resolving, downloading, verifying, extracting or installing a module.
 * All kinds are terminal for the operation that raised them, picomodule never retries on its own.
 */
public enum FailureKind {

    /**
     * The user supplied module reference (or install name) could not be classified or is unsafe.
     */
    INVALID_REFERENCE,

    /**
     * The module does not exist in the registry, the repository holds no module descriptor at the requested
     * location or the module is not installed.
     */
    MODULE_NOT_FOUND,

    /**
     * A network fetch did not complete before its deadline.
     */
    TIMEOUT,

    /**
     * The declared or observed size of a fetched payload exceeded its ceiling.
     */
    PAYLOAD_TOO_LARGE,

    /**
     * The registry index is not valid JSON or contains an entry that matches neither known wire format.
     */
    MALFORMED_INDEX,

    /**
     * A tarball distributed module has no checksum.
     */
    MISSING_CHECKSUM,

    /**
     * The digest (or declared size) of the fetched bytes does not match the registry.
     */
    CHECKSUM_MISMATCH,

    /**
     * A checksum string is not of the form {@code sha256:<64 lowercase hex>}. This is a configuration error
     * of the registry, not a verification failure.
     */
    INVALID_CHECKSUM_FORMAT,

    /**
     * An archive member is a link or of another unsupported type.
     */
    UNSAFE_ARCHIVE_ENTRY,

    /**
     * An archive member name is absolute, contains a ".." segment or escapes the extraction root.
     */
    PATH_TRAVERSAL,

    /**
     * An archive exceeds one of the configured extraction limits.
     */
    ARCHIVE_QUOTA_EXCEEDED,

    /**
     * An extracted archive does not consist of exactly one top-level directory.
     */
    AMBIGUOUS_ARCHIVE_LAYOUT,

    /**
     * The archive is not a well-formed ustar archive (bad header checksum, wrong magic, truncated stream).
     */
    MALFORMED_ARCHIVE,

    /**
     * The module has no entry in the install manifest.
     */
    MANIFEST_NOT_FOUND,

    /**
     * The configured provenance policy refuses the operation.
     */
    POLICY_VIOLATION,

    /**
     * The remote answered with a non-successful status or the transport failed.
     */
    DOWNLOAD_FAILED,

    /**
     * Local file IO failed.
     */
    IO_FAILURE;
}
