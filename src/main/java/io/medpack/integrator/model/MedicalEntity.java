package io.medpack.integrator.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Common view over diseases, symptoms, examinations and treatments.
 */
public interface MedicalEntity {

    @NotNull
    String getId();

    @NotNull
    String getName();

    /**
     * Tag of the package this instance was loaded from, or null before loading completes.
     */
    @Nullable
    String getPackageTag();

    @NotNull
    EntityKind getKind();
}
