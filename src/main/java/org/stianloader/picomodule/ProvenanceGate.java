package org.stianloader.picomodule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picomodule.manifest.ProvenanceRecord;
import org.stianloader.picomodule.manifest.ProvenanceStore;

/**
 * The gate in front of certified execution: a module passes only if it was installed from a checksum-verified
 * registry tarball and none of its files changed since.
 */
public final class ProvenanceGate {

    private ProvenanceGate() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Check an installed module.
     *
     * @param moduleDir The directory of the installed module
     * @return The provenance record of the module
     * @throws ModuleException With {@link FailureKind#POLICY_VIOLATION} if the module has no readable registry
     * provenance record or its files no longer match the recorded integrity tree
     */
    @NotNull
    public static ProvenanceRecord check(@NotNull Path moduleDir) {
        if (!Files.isDirectory(moduleDir, LinkOption.NOFOLLOW_LINKS)) {
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Not a module directory: " + moduleDir);
        }
        try {
            ProvenanceRecord record = ProvenanceStore.read(moduleDir);
            if (record == null) {
                throw new ModuleException(FailureKind.POLICY_VIOLATION, "Module has no provenance record: " + moduleDir);
            }
            if (!(record.source() instanceof ProvenanceRecord.RegistrySource)) {
                throw new ModuleException(FailureKind.POLICY_VIOLATION, "Module was not installed from a registry tarball (source type '"
                        + record.source().type() + "'): " + moduleDir);
            }
            record.integrity().verify(moduleDir);
            return record;
        } catch (IOException e) {
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Unable to verify the integrity of " + moduleDir + ": " + e.getMessage(), e);
        } catch (ModuleException e) {
            if (e.getKind() == FailureKind.POLICY_VIOLATION) {
                throw e;
            }
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Integrity check failed for " + moduleDir + ": " + e.getMessage(),
                    e.getOffendingPath(), e.getExpected(), e.getActual(), e);
        }
    }
}
