package com.inventoryforecast.store;

import com.inventoryforecast.model.PipelineArtifact;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.WeatherObservation;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Mutable per-session holder; every access is synchronized on the instance. */
final class SessionArtifacts {

    private final Map<PipelineStage, Entry> entries = new EnumMap<>(PipelineStage.class);
    private List<WeatherObservation> weather = List.of();

    synchronized void put(PipelineStage stage, PipelineArtifact artifact) {
        entries.put(stage, new Entry(artifact, false, Instant.now()));
        markStale(stage.dependents());
    }

    synchronized Entry get(PipelineStage stage) {
        return entries.get(stage);
    }

    synchronized void markStale(Iterable<PipelineStage> stages) {
        for (PipelineStage stage : stages) {
            entries.computeIfPresent(stage, (k, e) -> new Entry(e.artifact(), true, e.updatedAt()));
        }
    }

    synchronized List<WeatherObservation> weather() {
        return weather;
    }

    synchronized void weather(List<WeatherObservation> observations) {
        this.weather = List.copyOf(observations);
    }

    record Entry(PipelineArtifact artifact, boolean stale, Instant updatedAt) {
    }
}
