package com.inventoryforecast.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineStageTest {

    @Test
    void dependents_areTransitive() {
        assertThat(PipelineStage.PREPROCESSING.dependents()).containsExactlyInAnyOrder(
            PipelineStage.FEATURE_ENGINEERING, PipelineStage.TRAINING, PipelineStage.FORECASTING,
            PipelineStage.EVALUATION, PipelineStage.INSIGHTS);
    }

    @Test
    void dependents_followBranches() {
        assertThat(PipelineStage.TRAINING.dependents())
            .containsExactlyInAnyOrder(PipelineStage.FORECASTING, PipelineStage.EVALUATION, PipelineStage.INSIGHTS);
        assertThat(PipelineStage.FORECASTING.dependents()).containsExactly(PipelineStage.INSIGHTS);
        assertThat(PipelineStage.EVALUATION.dependents()).isEmpty();
    }

    @Test
    void upload_hasNoUpstream() {
        assertThat(PipelineStage.UPLOAD.upstream()).isNull();
        assertThat(PipelineStage.UPLOAD.dependents()).hasSize(PipelineStage.values().length - 1);
    }
}
