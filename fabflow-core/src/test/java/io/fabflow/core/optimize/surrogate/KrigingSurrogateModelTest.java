package io.fabflow.core.optimize.surrogate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.fabflow.core.optimize.SurrogateModel;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class KrigingSurrogateModelTest {

    private static final List<TrainingSample> HISTORY =
            List.of(
                    TrainingSample.of(50, 10, 1),
                    TrainingSample.of(100, 20, 1),
                    TrainingSample.of(60, 10, 2),
                    TrainingSample.of(120, 20, 2));

    private static final double[] THETA = {1e-2, 1e-2};

    @Nested
    class Fitting {

        @Test
        void shouldInterpolateTrainingRuns() {
            KrigingSurrogateModel model = KrigingSurrogateModel.fit(HISTORY, THETA);

            for (TrainingSample sample : HISTORY) {
                assertThat(model.predict(sample.inputs())).isCloseTo(sample.output(), within(1e-4));
            }
        }

        @Test
        void shouldRevertToMeanAtCentreOfSymmetricDesign() {
            KrigingSurrogateModel model = KrigingSurrogateModel.fit(HISTORY, THETA);

            assertThat(model.getMean()).isCloseTo(82.5, within(1e-6));
            assertThat(model.predict(new double[] {15, 1.5})).isCloseTo(82.5, within(1e-6));
        }

        @Test
        void shouldPredictConstantFromSingleRun() {
            KrigingSurrogateModel model =
                    KrigingSurrogateModel.fit(List.of(TrainingSample.of(70, 15, 1.5)), THETA);

            assertThat(model.getMean()).isCloseTo(70.0, within(1e-6));
            assertThat(model.predict(new double[] {40, 0.5})).isCloseTo(70.0, within(1e-6));
        }

        @Test
        void shouldRejectInconsistentDimensions() {
            List<TrainingSample> mixed =
                    List.of(TrainingSample.of(50, 10, 1), TrainingSample.of(60, 10));

            assertThatThrownBy(() -> KrigingSurrogateModel.fit(mixed, THETA))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("sample 1");
        }

        @Test
        void shouldRejectEmptyHistoryAndBadTheta() {
            assertThatThrownBy(() -> KrigingSurrogateModel.fit(List.of(), THETA))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> KrigingSurrogateModel.fit(HISTORY, new double[] {1e-2, 0}))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectWrongPredictionArity() {
            KrigingSurrogateModel model = KrigingSurrogateModel.fit(HISTORY, THETA);

            assertThatThrownBy(() -> model.predict(new double[] {15}))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Samples {

        @Test
        void shouldCompareByValue() {
            TrainingSample sample = TrainingSample.of(50, 10, 1);

            assertThat(sample).isEqualTo(TrainingSample.of(50, 10, 1));
            assertThat(sample).hasSameHashCodeAs(TrainingSample.of(50, 10, 1));
            assertThat(sample).isNotEqualTo(TrainingSample.of(50, 10, 2));
            assertThat(sample.toString()).contains("[10.0, 1.0]");
        }

        @Test
        void shouldNotExposeInternalInputs() {
            double[] inputs = {10, 1};
            TrainingSample sample = new TrainingSample(inputs, 50);
            inputs[0] = 99;
            sample.inputs()[1] = 99;

            assertThat(sample.inputs()).containsExactly(10.0, 1.0);
        }
    }

    @Nested
    class Registry {

        @Test
        void shouldResolveRegisteredModels() {
            DefaultSurrogateModelRegistry registry = new DefaultSurrogateModelRegistry();
            SurrogateModel model = KrigingSurrogateModel.fit(HISTORY, THETA);
            registry.register("models/cvd_01_sio2.pkl", model);

            assertThat(registry.get("models/cvd_01_sio2.pkl")).containsSame(model);
            assertThat(registry.get("models/unknown.pkl")).isEmpty();
            assertThat(registry.references()).containsExactly("models/cvd_01_sio2.pkl");
        }
    }
}
