package io.fabflow.core.change;

import static io.fabflow.core.TestFixtures.addition;
import static io.fabflow.core.TestFixtures.patterning;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ChangeDescriptorValidatorTest {

    private final ChangeDescriptorValidator validator = new ChangeDescriptorValidator();

    @Nested
    class SingleDescriptor {

        @Test
        void shouldAcceptCompleteDescriptor() {
            assertThat(validator.violations(addition(0, "SiO2", 2.0))).isEmpty();
        }

        @Test
        void shouldAcceptMissingPolarity() {
            ChangeDescriptor descriptor = addition(0, "SiO2", 2.0).toBuilder().polarity(null).build();

            assertThat(validator.violations(descriptor)).isEmpty();
        }

        @Test
        void shouldReportEveryMissingAttribute() {
            ChangeDescriptor descriptor = ChangeDescriptor.builder().build();

            assertThat(validator.violations(descriptor))
                    .containsExactly(
                            "primary_material is required",
                            "wafer_size is required",
                            "order_index must be >= 0",
                            "aspect_ratio must be a positive number",
                            "conformality_score must lie in [0, 1]",
                            "target_metric must be a non-negative number");
        }

        @Test
        void shouldRejectConformalityOutsideUnitInterval() {
            ChangeDescriptor descriptor =
                    addition(0, "SiO2", 2.0).toBuilder().conformalityScore(1.5).build();

            assertThat(validator.violations(descriptor))
                    .containsExactly("conformality_score must lie in [0, 1]");
        }

        @Test
        void shouldRejectNonPositiveAspectRatio() {
            ChangeDescriptor descriptor = addition(0, "SiO2", 0.0);

            assertThat(validator.violations(descriptor))
                    .containsExactly("aspect_ratio must be a positive number");
        }

        @Test
        void shouldOnlyRequireStepIdentifierForPatterning() {
            assertThat(validator.violations(patterning(1, "LITHO_STEP_2"))).isEmpty();

            ChangeDescriptor withoutStep =
                    patterning(1, "LITHO_STEP_2").toBuilder().stepIdentifier(" ").build();
            assertThat(validator.violations(withoutStep))
                    .containsExactly("step_id is required for a patterning transition");
        }

        @Test
        void shouldRequireGeometryForPatterningWithPolarity() {
            ChangeDescriptor descriptor =
                    patterning(1, "LITHO_STEP_2").toBuilder().polarity(Polarity.ADDITION).build();

            assertThat(validator.violations(descriptor))
                    .containsExactly(
                            "aspect_ratio must be a positive number",
                            "conformality_score must lie in [0, 1]",
                            "target_metric must be a non-negative number");
        }

        @Test
        void shouldAcceptPatterningWithPolarityAndGeometry() {
            ChangeDescriptor descriptor =
                    addition(1, "SiO2", 2.0).toBuilder().patterning("LITHO_STEP_2").build();

            assertThat(validator.violations(descriptor)).isEmpty();
        }
    }

    @Nested
    class Sequence {

        @Test
        void shouldFindDuplicateOrderIndicesOnce() {
            List<ChangeDescriptor> changes =
                    List.of(
                            addition(0, "SiO2", 2.0),
                            addition(1, "Si3N4", 2.0),
                            addition(0, "Al", 2.0),
                            addition(0, "W", 2.0));

            assertThat(validator.duplicateOrderIndices(changes)).containsExactly(0);
        }

        @Test
        void shouldReturnEmptyForUniqueIndices() {
            assertThat(
                            validator.duplicateOrderIndices(
                                    List.of(addition(0, "SiO2", 2.0), addition(1, "Al", 2.0))))
                    .isEmpty();
        }
    }

    @Test
    void descriptorShouldAlwaysContainPrimaryMaterial() {
        ChangeDescriptor descriptor =
                addition(0, "SiO2", 2.0).toBuilder().affectedMaterials(Set.of("Si3N4")).build();

        assertThat(descriptor.affectedMaterials()).containsExactlyInAnyOrder("SiO2", "Si3N4");
    }
}
