package org.stianloader.picomodule;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.UUID;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.archive.ExtractionLimits;
import org.stianloader.picomodule.integrity.ModuleIntegrity;
import org.stianloader.picomodule.internal.FileUtil;
import org.stianloader.picomodule.logging.LoggingAdapter;
import org.stianloader.picomodule.manifest.ProvenanceRecord;
import org.stianloader.picomodule.manifest.ProvenanceStore;

/**
 * Moves a located module into its final place. The module is copied into a staging directory next to the
 * target, provenance is written into the staging copy and only then the staging copy is swapped in. A failed
 * materialization leaves the previous installation (if any) in place.
 */
public class ModuleMaterializer {

    public enum Outcome {
        CREATED,
        REPLACED_EXISTING;
    }

    @NotNull
    private final ExtractionLimits limits;

    public ModuleMaterializer(@NotNull ExtractionLimits limits) {
        this.limits = limits;
    }

    /**
     * Materialize a module.
     *
     * @param moduleRoot The located module directory, usually inside a scratch extraction
     * @param target The final location of the module
     * @param provenance The origin to record in the module's provenance file, or null to write none
     * @param provenanceRequired Whether failing to write provenance fails the materialization
     * @return Whether the target was created or an existing installation replaced
     * @throws IOException If copying or swapping fails
     * @throws ModuleException With {@link FailureKind#UNSAFE_ARCHIVE_ENTRY} if the module contains symbolic links, or
     * {@link FailureKind#POLICY_VIOLATION} if provenance is required but could not be written
     */
    @NotNull
    public Outcome materialize(@NotNull Path moduleRoot, @NotNull Path target, ProvenanceRecord.@Nullable Source provenance, boolean provenanceRequired) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        String nonce = UUID.randomUUID().toString();
        Path staging = parent.resolve("." + target.getFileName() + ".staging-" + nonce);
        Path backup = parent.resolve("." + target.getFileName() + ".old-" + nonce);

        try {
            FileUtil.copyTree(moduleRoot, staging);
            if (provenance != null) {
                this.writeProvenance(staging, provenance, provenanceRequired);
            }

            if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                ModuleMaterializer.move(staging, target);
                return Outcome.CREATED;
            }

            ModuleMaterializer.move(target, backup);
            try {
                ModuleMaterializer.move(staging, target);
            } catch (IOException e) {
                try {
                    ModuleMaterializer.move(backup, target);
                } catch (IOException restoreFailure) {
                    e.addSuppressed(restoreFailure);
                }
                throw e;
            }
            FileUtil.deleteScratch(backup);
            return Outcome.REPLACED_EXISTING;
        } finally {
            if (Files.exists(staging, LinkOption.NOFOLLOW_LINKS)) {
                FileUtil.deleteScratch(staging);
            }
        }
    }

    private void writeProvenance(@NotNull Path staging, ProvenanceRecord.@NotNull Source source, boolean required) {
        try {
            ModuleIntegrity integrity = ModuleIntegrity.compute(staging, this.limits.maxFiles(), this.limits.maxTotalBytes(), this.limits.maxSingleFileBytes());
            ProvenanceStore.write(staging, new ProvenanceRecord(ProvenanceRecord.SPEC, Instant.now().toString(), source, integrity));
        } catch (IOException | ModuleException e) {
            if (required) {
                throw new ModuleException(FailureKind.POLICY_VIOLATION, "Unable to write the provenance record of " + staging + ": " + e.getMessage(), e);
            }
            LoggingAdapter.getDefaultLogger().warn(ModuleMaterializer.class, "Unable to write provenance record for {}", staging, e);
        }
    }

    private static void move(@NotNull Path source, @NotNull Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }
}
