package com.inventoryforecast.service;

import com.inventoryforecast.TestDatasets;
import com.inventoryforecast.algorithm.ForecastingAlgorithm;
import com.inventoryforecast.algorithm.ForecastingAlgorithms;
import com.inventoryforecast.algorithm.HoltSmoothingAlgorithm;
import com.inventoryforecast.algorithm.LinearRegressionAlgorithm;
import com.inventoryforecast.client.StaticHolidayCalendar;
import com.inventoryforecast.config.PipelineProperties;
import com.inventoryforecast.exception.TrainingException;
import com.inventoryforecast.model.FeatureOptions;
import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FeatureTable;
import com.inventoryforecast.model.FittedModel;
import com.inventoryforecast.model.ModelKind;
import com.inventoryforecast.model.TrainedModel;
import com.inventoryforecast.model.TrainedModelSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModelTrainingServiceTest {

    @Mock
    ForecastingAlgorithms mockAlgorithms;

    private PipelineProperties properties;
    private FeatureTable features;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getTraining().setForestTrees(10);
        properties.getTraining().setBoostingIterations(20);
        FeatureEngineeringService engineering = new FeatureEngineeringService(properties, new StaticHolidayCalendar());
        features = engineering.engineer(TestDatasets.dailyTable(TestDatasets.seasonalSeries(150)),
            FeatureOptions.defaults(), List.of());
    }

    @Test
    void train_allKinds_splitsChronologically() {
        ModelTrainingService service = new ModelTrainingService(properties, new ForecastingAlgorithms(properties));

        TrainedModelSet set = service.train(features, EnumSet.allOf(ModelKind.class), 0.2);

        assertThat(set.getModels()).containsOnlyKeys(ModelKind.values());
        assertThat(set.getReport().getFailures()).isEmpty();
        assertThat(set.getReport().getSplit().trainSize()).isEqualTo(96);
        assertThat(set.getReport().getSplit().testSize()).isEqualTo(24);
        assertThat(set.getReport().getSplit().lastTrainDate()).isBefore(set.getReport().getSplit().firstTestDate());
        for (TrainedModel model : set.getModels().values()) {
            assertThat(model.getTestPredictions()).hasSize(24).allMatch(Double::isFinite);
            assertThat(model.getResidualStd()).isNotNegative();
            assertThat(model.getSourceFingerprint()).isEqualTo(features.getFingerprint());
        }
    }

    @Test
    void train_defaultFraction_fromConfiguration() {
        ModelTrainingService service = new ModelTrainingService(properties, new ForecastingAlgorithms(properties));

        TrainedModelSet set = service.train(features, List.of(ModelKind.LINEAR), null);

        assertThat(set.getReport().getSplit().testSize()).isEqualTo(24);
        assertThat(set.getReport().getTrained()).containsExactly(ModelKind.LINEAR);
    }

    @Test
    void train_emptyKinds_throws() {
        ModelTrainingService service = new ModelTrainingService(properties, mockAlgorithms);

        assertThatThrownBy(() -> service.train(features, List.of(), 0.2))
            .isInstanceOf(TrainingException.class)
            .hasMessageContaining("At least one model kind");
    }

    @Test
    void train_tooFewTrainRows_throws() {
        ModelTrainingService service = new ModelTrainingService(properties, mockAlgorithms);

        assertThatThrownBy(() -> service.train(features, List.of(ModelKind.LINEAR), 0.9))
            .isInstanceOf(TrainingException.class)
            .hasMessageContaining("at least 20");
    }

    @Test
    void train_invalidFraction_throws() {
        ModelTrainingService service = new ModelTrainingService(properties, mockAlgorithms);

        assertThatThrownBy(() -> service.train(features, List.of(ModelKind.LINEAR), 1.0))
            .isInstanceOf(TrainingException.class)
            .hasMessageContaining("testFraction");
    }

    @Test
    void train_oneKindFails_othersStillTrain() {
        when(mockAlgorithms.forKind(ModelKind.LINEAR)).thenReturn(new LinearRegressionAlgorithm());
        when(mockAlgorithms.forKind(ModelKind.TREE_ENSEMBLE)).thenReturn(failing(ModelKind.TREE_ENSEMBLE));
        when(mockAlgorithms.forKind(ModelKind.CLASSICAL_TIME_SERIES)).thenReturn(new HoltSmoothingAlgorithm());
        ModelTrainingService service = new ModelTrainingService(properties, mockAlgorithms);

        TrainedModelSet set = service.train(features,
            List.of(ModelKind.LINEAR, ModelKind.TREE_ENSEMBLE, ModelKind.CLASSICAL_TIME_SERIES), 0.2);

        assertThat(set.getModels()).containsOnlyKeys(ModelKind.LINEAR, ModelKind.CLASSICAL_TIME_SERIES);
        assertThat(set.getReport().getFailures()).containsOnlyKeys(ModelKind.TREE_ENSEMBLE);
        assertThat(set.getReport().getFailures().get(ModelKind.TREE_ENSEMBLE)).contains("learner exploded");
    }

    @Test
    void train_nonFinitePredictions_countAsFailure() {
        when(mockAlgorithms.forKind(ModelKind.LINEAR)).thenReturn(new LinearRegressionAlgorithm());
        when(mockAlgorithms.forKind(ModelKind.BOOSTED_ENSEMBLE)).thenReturn(returning(ModelKind.BOOSTED_ENSEMBLE, Double.NaN));
        ModelTrainingService service = new ModelTrainingService(properties, mockAlgorithms);

        TrainedModelSet set = service.train(features, List.of(ModelKind.LINEAR, ModelKind.BOOSTED_ENSEMBLE), 0.2);

        assertThat(set.getModels()).containsOnlyKeys(ModelKind.LINEAR);
        assertThat(set.getReport().getFailures().get(ModelKind.BOOSTED_ENSEMBLE)).contains("non-finite");
    }

    @Test
    void train_everyKindFails_throwsWithReasons() {
        when(mockAlgorithms.forKind(ModelKind.TREE_ENSEMBLE)).thenReturn(failing(ModelKind.TREE_ENSEMBLE));
        ModelTrainingService service = new ModelTrainingService(properties, mockAlgorithms);

        assertThatThrownBy(() -> service.train(features, List.of(ModelKind.TREE_ENSEMBLE), 0.2))
            .isInstanceOf(TrainingException.class)
            .satisfies(e -> assertThat(((TrainingException) e).getFailures()).containsKey(ModelKind.TREE_ENSEMBLE));
    }

    private static ForecastingAlgorithm failing(ModelKind kind) {
        return new ForecastingAlgorithm() {
            @Override
            public ModelKind kind() {
                return kind;
            }

            @Override
            public FittedModel fit(List<FeatureRow> trainRows, List<String> columns) {
                throw new IllegalStateException("learner exploded");
            }
        };
    }

    private static ForecastingAlgorithm returning(ModelKind kind, double value) {
        return new ForecastingAlgorithm() {
            @Override
            public ModelKind kind() {
                return kind;
            }

            @Override
            public FittedModel fit(List<FeatureRow> trainRows, List<String> columns) {
                return new FittedModel() {
                    @Override
                    public double predict(FeatureRow row) {
                        return value;
                    }

                    @Override
                    public String describe() {
                        return "constant";
                    }
                };
            }
        };
    }
}
