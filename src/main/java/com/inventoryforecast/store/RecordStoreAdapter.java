package com.inventoryforecast.store;

import com.inventoryforecast.model.PipelineArtifact;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.RawRecord;
import com.inventoryforecast.model.StageStatus;
import com.inventoryforecast.model.WeatherObservation;

import java.util.List;
import java.util.Optional;

/**
 * Boundary to the session's persisted data: the active raw dataset and the
 * artifacts produced by each pipeline stage.
 *
 * <p>Writing an artifact marks every dependent stage of the same session stale.
 * Reading a missing or stale artifact fails with
 * {@link com.inventoryforecast.exception.ArtifactNotFoundException}.
 */
public interface RecordStoreAdapter {

    /** Records of the active dataset in upload order; empty when nothing was uploaded. */
    List<RawRecord> readActiveDataset(String sessionId);

    /** Replaces the active dataset and marks every artifact of the session stale. */
    int replaceActiveDataset(String sessionId, List<RawRecord> records, String requestId);

    void replaceWeather(String sessionId, List<WeatherObservation> observations);

    List<WeatherObservation> readWeather(String sessionId);

    void writeArtifact(String sessionId, PipelineStage stage, PipelineArtifact artifact);

    <T extends PipelineArtifact> T readArtifact(String sessionId, PipelineStage stage, Class<T> type);

    /** Like {@link #readArtifact} but empty instead of failing when missing or stale. */
    <T extends PipelineArtifact> Optional<T> findFreshArtifact(String sessionId, PipelineStage stage, Class<T> type);

    /** Marks the given stage and everything downstream of it stale. */
    void invalidateFrom(String sessionId, PipelineStage stage);

    List<StageStatus> stageStatus(String sessionId);
}
