package com.inventoryforecast.store;

import com.inventoryforecast.entity.SalesRecordEntity;
import com.inventoryforecast.exception.ArtifactNotFoundException;
import com.inventoryforecast.model.PipelineArtifact;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.RawRecord;
import com.inventoryforecast.model.StageStatus;
import com.inventoryforecast.model.WeatherObservation;
import com.inventoryforecast.repository.SalesRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultRecordStoreAdapterTest {

    @Mock private SalesRecordRepository repository;
    @Captor private ArgumentCaptor<List<SalesRecordEntity>> captor;

    private DefaultRecordStoreAdapter store;

    @BeforeEach
    void setUp() {
        store = new DefaultRecordStoreAdapter(repository);
    }

    private static PipelineArtifact artifact(String fingerprint) {
        return () -> fingerprint;
    }

    @Test
    void readArtifact_missing_throwsNotFound() {
        assertThatThrownBy(() -> store.readArtifact("s1", PipelineStage.TRAINING, PipelineArtifact.class))
            .isInstanceOf(ArtifactNotFoundException.class)
            .hasMessageContaining("Run training first");
    }

    @Test
    void writeArtifact_marksDownstreamStale() {
        store.writeArtifact("s1", PipelineStage.FEATURE_ENGINEERING, artifact("f1"));
        store.writeArtifact("s1", PipelineStage.TRAINING, artifact("t1"));
        store.writeArtifact("s1", PipelineStage.EVALUATION, artifact("e1"));

        store.writeArtifact("s1", PipelineStage.FEATURE_ENGINEERING, artifact("f2"));

        assertThat(store.readArtifact("s1", PipelineStage.FEATURE_ENGINEERING, PipelineArtifact.class)
            .getFingerprint()).isEqualTo("f2");
        assertThatThrownBy(() -> store.readArtifact("s1", PipelineStage.TRAINING, PipelineArtifact.class))
            .isInstanceOf(ArtifactNotFoundException.class)
            .hasMessageContaining("stale");
        assertThat(store.findFreshArtifact("s1", PipelineStage.EVALUATION, PipelineArtifact.class)).isEmpty();
    }

    @Test
    void rewritingAStage_clearsItsOwnStaleFlag() {
        store.writeArtifact("s1", PipelineStage.PREPROCESSING, artifact("p1"));
        store.writeArtifact("s1", PipelineStage.FEATURE_ENGINEERING, artifact("f1"));
        store.writeArtifact("s1", PipelineStage.PREPROCESSING, artifact("p2"));

        store.writeArtifact("s1", PipelineStage.FEATURE_ENGINEERING, artifact("f2"));

        assertThat(store.findFreshArtifact("s1", PipelineStage.FEATURE_ENGINEERING, PipelineArtifact.class))
            .map(PipelineArtifact::getFingerprint).contains("f2");
    }

    @Test
    void sessionsAreIsolated() {
        store.writeArtifact("s1", PipelineStage.PREPROCESSING, artifact("p1"));
        store.writeArtifact("s2", PipelineStage.PREPROCESSING, artifact("p2"));
        store.writeArtifact("s2", PipelineStage.FEATURE_ENGINEERING, artifact("f2"));

        store.invalidateFrom("s1", PipelineStage.PREPROCESSING);

        assertThat(store.findFreshArtifact("s1", PipelineStage.PREPROCESSING, PipelineArtifact.class)).isEmpty();
        assertThat(store.findFreshArtifact("s2", PipelineStage.FEATURE_ENGINEERING, PipelineArtifact.class)).isPresent();
    }

    @Test
    void replaceActiveDataset_persistsInUploadOrderAndStalesEverything() {
        store.writeArtifact("s1", PipelineStage.PREPROCESSING, artifact("p1"));
        RawRecord first = RawRecord.builder().date(LocalDate.of(2024, 1, 1)).productId("A").quantity(3.0).build();
        RawRecord second = RawRecord.builder().date(LocalDate.of(2024, 1, 2)).productId("B").quantity(4.0).build();

        int stored = store.replaceActiveDataset("s1", List.of(first, second), "req-1");

        assertThat(stored).isEqualTo(2);
        verify(repository).deleteBySessionId("s1");
        verify(repository).saveAll(captor.capture());
        assertThat(captor.getValue()).extracting(SalesRecordEntity::getUploadPosition).containsExactly(0, 1);
        assertThat(captor.getValue()).extracting(SalesRecordEntity::getRequestId).containsOnly("req-1");
        assertThat(store.findFreshArtifact("s1", PipelineStage.PREPROCESSING, PipelineArtifact.class)).isEmpty();
    }

    @Test
    void replaceWeather_stalesFeatureEngineeringButNotPreprocessing() {
        store.writeArtifact("s1", PipelineStage.PREPROCESSING, artifact("p1"));
        store.writeArtifact("s1", PipelineStage.FEATURE_ENGINEERING, artifact("f1"));

        store.replaceWeather("s1", List.of(WeatherObservation.builder()
            .date(LocalDate.of(2024, 1, 1)).temperature(20.0).precipitation(0.0).build()));

        assertThat(store.readWeather("s1")).hasSize(1);
        assertThat(store.findFreshArtifact("s1", PipelineStage.PREPROCESSING, PipelineArtifact.class)).isPresent();
        assertThat(store.findFreshArtifact("s1", PipelineStage.FEATURE_ENGINEERING, PipelineArtifact.class)).isEmpty();
    }

    @Test
    void stageStatus_reportsUploadFromRepository() {
        when(repository.countBySessionId("s1")).thenReturn(5L);
        store.writeArtifact("s1", PipelineStage.PREPROCESSING, artifact("p1"));

        List<StageStatus> statuses = store.stageStatus("s1");

        assertThat(statuses).hasSize(PipelineStage.values().length);
        assertThat(statuses.get(0).present()).isTrue();
        assertThat(statuses.get(1).fingerprint()).isEqualTo("p1");
        assertThat(statuses.get(2).present()).isFalse();
    }

    @Test
    void writeArtifact_uploadStage_isRejected() {
        assertThatThrownBy(() -> store.writeArtifact("s1", PipelineStage.UPLOAD, artifact("u")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
