package com.inventoryforecast.model;

/** An immutable stage output, versioned by a content fingerprint. */
public interface PipelineArtifact {
    String getFingerprint();
}
