package io.fabflow.core.flow;

import static io.fabflow.core.TestFixtures.LAYOUT;
import static io.fabflow.core.TestFixtures.LINEAR_MODEL;
import static io.fabflow.core.TestFixtures.addition;
import static io.fabflow.core.TestFixtures.lithoTool;
import static io.fabflow.core.TestFixtures.patterning;
import static io.fabflow.core.TestFixtures.referenceChanges;
import static io.fabflow.core.TestFixtures.referenceTools;
import static io.fabflow.core.TestFixtures.removal;
import static io.fabflow.core.TestFixtures.tool;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.change.ChangeDescriptorValidator;
import io.fabflow.core.change.Polarity;
import io.fabflow.core.change.WaferSize;
import io.fabflow.core.classify.ClassificationThresholds;
import io.fabflow.core.classify.ProcessCategory;
import io.fabflow.core.classify.ProcessClassifier;
import io.fabflow.core.flow.CollaboratorUnavailableException.Collaborator;
import io.fabflow.core.flow.FlowPlanningException.FailureReason;
import io.fabflow.core.litho.LithographyPlanner;
import io.fabflow.core.litho.LithographySubRecipes;
import io.fabflow.core.litho.MaskExtractor;
import io.fabflow.core.litho.MaskServiceUnavailableException;
import io.fabflow.core.optimize.BoundedQuasiNewtonMinimizer;
import io.fabflow.core.optimize.GridSearch;
import io.fabflow.core.optimize.ParameterOptimizer;
import io.fabflow.core.optimize.ParameterSpace;
import io.fabflow.core.recipe.RecipeParameters;
import io.fabflow.core.tool.DeadlineKnowledgeStore;
import io.fabflow.core.tool.InMemoryKnowledgeStore;
import io.fabflow.core.tool.KnowledgeStore;
import io.fabflow.core.tool.KnowledgeStoreUnavailableException;
import io.fabflow.core.tool.ToolRecord;
import io.fabflow.core.tool.ToolSelector;
import io.fabflow.core.tool.ToolStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class FlowOrchestratorTest {

    private static final MaskExtractor MASKS =
            (layout, stepId) -> "output/mask_" + stepId + ".gds";

    private static final Map<String, String> LAYOUTS = Map.of("LITHO_STEP_2", LAYOUT);

    private List<FlowEvent> events;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
    }

    private FlowOrchestrator orchestrator(
            KnowledgeStore store, MaskExtractor masks, AuxiliaryStepPolicy policy) {
        FlowOrchestrator orchestrator =
                new FlowOrchestrator(
                        new ChangeDescriptorValidator(),
                        ProcessClassifier.standard(ClassificationThresholds.defaults()),
                        new ToolSelector(store),
                        new ParameterOptimizer(
                                ParameterSpace.defaults(),
                                new BoundedQuasiNewtonMinimizer(100, 1e-6),
                                new GridSearch(11)),
                        new LithographyPlanner(masks, LithographySubRecipes.defaults()),
                        policy,
                        "silicon");
        orchestrator.addObserver(events::add);
        return orchestrator;
    }

    private FlowOrchestrator orchestrator(List<ToolRecord> tools) {
        return orchestrator(new InMemoryKnowledgeStore(tools), MASKS, AuxiliaryStepPolicy.none());
    }

    @Nested
    class ReferenceScenario {

        @Test
        void shouldPlanDepositionLithographyEtch() throws Exception {
            FlowResult result =
                    orchestrator(referenceTools())
                            .plan(new FlowRequest(referenceChanges(), LAYOUTS));

            ProcessFlow flow = result.flow();
            assertThat(flow.steps())
                    .extracting(ProcessStep::stepNumber, ProcessStep::processType, ProcessStep::toolId)
                    .containsExactly(
                            tuple(1, "Deposition", "CVD_01"),
                            tuple(2, "Lithography", "LITHO_01"),
                            tuple(3, "Etch", "ETCH_01"));
            assertThat(flow.step(2).recipeParameters().maskFile())
                    .hasValueSatisfying(mask -> assertThat(mask).isNotBlank());
            assertThat(flow.step(1).recipeParameters().numeric(RecipeParameters.ACHIEVED_THICKNESS))
                    .isPresent();
            assertThat(flow.step(3).recipeParameters().numeric(RecipeParameters.ACHIEVED_DEPTH))
                    .isPresent();
            assertThat(result.hasDiagnostics()).isFalse();
        }

        @Test
        void shouldOrderByOrderIndexNotInputPosition() throws Exception {
            List<ChangeDescriptor> shuffled = new ArrayList<>(referenceChanges());
            Collections.reverse(shuffled);

            FlowResult result =
                    orchestrator(referenceTools()).plan(new FlowRequest(shuffled, LAYOUTS));

            assertThat(result.flow().steps())
                    .extracting(ProcessStep::processType)
                    .containsExactly("Deposition", "Lithography", "Etch");
        }

        @Test
        void shouldPublishStateTransitionsEndingInCompletion() throws Exception {
            orchestrator(referenceTools()).plan(new FlowRequest(referenceChanges(), LAYOUTS));

            assertThat(events.get(0))
                    .isInstanceOfSatisfying(
                            FlowEvent.StateEntered.class,
                            e -> assertThat(e.state()).isEqualTo(FlowState.INIT));
            assertThat(events.get(events.size() - 1)).isInstanceOf(FlowEvent.FlowCompleted.class);
            assertThat(events).filteredOn(e -> e instanceof FlowEvent.StepEmitted).hasSize(3);
            assertThat(events)
                    .filteredOn(e -> e instanceof FlowEvent.StateEntered)
                    .extracting(e -> ((FlowEvent.StateEntered) e).state())
                    .containsSubsequence(
                            FlowState.CLASSIFYING,
                            FlowState.SELECTING_TOOL,
                            FlowState.OPTIMIZING,
                            FlowState.STEP_EMITTED,
                            FlowState.DONE);
            assertThat(events).extracting(FlowEvent::flowId).containsOnly(events.get(0).flowId());
        }

        @Test
        void shouldIsolatePlanningCycles() throws Exception {
            List<ToolRecord> tools =
                    List.of(
                            tool("CVD_01", ProcessCategory.DEPOSITION),
                            tool("CVD_02", ProcessCategory.DEPOSITION));
            FlowOrchestrator orchestrator = orchestrator(tools);
            FlowRequest request =
                    FlowRequest.of(List.of(addition(0, "SiO2", 2.0), addition(1, "Si3N4", 2.0)));

            FlowResult first = orchestrator.plan(request);
            FlowResult second = orchestrator.plan(request);

            assertThat(first.flow().steps())
                    .extracting(ProcessStep::toolId)
                    .containsExactly("CVD_01", "CVD_02");
            assertThat(second.flow()).isEqualTo(first.flow());
        }
    }

    @Nested
    class SkippedSteps {

        @Test
        void shouldRenumberAfterUnknownClassification() throws Exception {
            ChangeDescriptor undetermined =
                    addition(1, "SiO2", 2.0).toBuilder().polarity(null).build();
            List<ChangeDescriptor> changes =
                    List.of(addition(0, "SiO2", 2.0), undetermined, removal(2, "SiO2", 0.2));

            FlowResult result = orchestrator(referenceTools()).plan(FlowRequest.of(changes));

            assertThat(result.flow().steps())
                    .extracting(ProcessStep::stepNumber, ProcessStep::sourceOrderIndex)
                    .containsExactly(
                            tuple(1, 0),
                            tuple(2, 2));
            assertThat(result.diagnostics())
                    .singleElement()
                    .satisfies(
                            d -> {
                                assertThat(d.kind()).isEqualTo(DiagnosticKind.UNKNOWN_CLASSIFICATION);
                                assertThat(d.orderIndex()).isEqualTo(1);
                            });
        }

        @Test
        void shouldSkipWhenNoToolIsCompatible() throws Exception {
            List<ToolRecord> withoutEtch =
                    List.of(tool("CVD_01", ProcessCategory.DEPOSITION), lithoTool("LITHO_01"));

            FlowResult result =
                    orchestrator(withoutEtch).plan(new FlowRequest(referenceChanges(), LAYOUTS));

            assertThat(result.flow().steps())
                    .extracting(ProcessStep::processType)
                    .containsExactly("Deposition", "Lithography");
            assertThat(result.diagnostics())
                    .extracting(Diagnostic::kind, Diagnostic::orderIndex)
                    .containsExactly(
                            tuple(DiagnosticKind.NO_COMPATIBLE_TOOL, 2));
        }

        @Test
        void shouldCheckMaterialsAlreadyOnWafer() throws Exception {
            ToolRecord copperSensitiveEtch =
                    new ToolRecord(
                            "ETCH_01",
                            ToolStatus.AVAILABLE,
                            WaferSize.MM_300,
                            Set.of(ProcessCategory.ETCH),
                            Set.of("Cu"),
                            LINEAR_MODEL);
            List<ToolRecord> tools =
                    List.of(tool("PVD_01", ProcessCategory.DEPOSITION), copperSensitiveEtch);

            FlowResult clean =
                    orchestrator(tools)
                            .plan(FlowRequest.of(List.of(addition(0, "SiO2", 2.0), removal(1, "SiO2", 0.2))));
            FlowResult contaminated =
                    orchestrator(tools)
                            .plan(FlowRequest.of(List.of(addition(0, "Cu", 2.0), removal(1, "SiO2", 0.2))));

            assertThat(clean.flow().size()).isEqualTo(2);
            assertThat(contaminated.flow().size()).isEqualTo(1);
            assertThat(contaminated.diagnostics())
                    .extracting(Diagnostic::kind)
                    .containsExactly(DiagnosticKind.NO_COMPATIBLE_TOOL);
        }

        @Test
        void shouldTreatExpiredKnowledgeQueryAsNoCompatibleTool() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            InMemoryKnowledgeStore catalog = new InMemoryKnowledgeStore(referenceTools());
            KnowledgeStore hangsOnEtch =
                    query -> {
                        if (query.category() == ProcessCategory.ETCH) {
                            try {
                                release.await();
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                        }
                        return catalog.findCandidateTools(query);
                    };
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                KnowledgeStore bounded =
                        new DeadlineKnowledgeStore(hangsOnEtch, Duration.ofMillis(100), executor);

                FlowResult result =
                        orchestrator(bounded, MASKS, AuxiliaryStepPolicy.none())
                                .plan(new FlowRequest(referenceChanges(), LAYOUTS));

                assertThat(result.flow().size()).isEqualTo(2);
                assertThat(result.diagnostics())
                        .extracting(Diagnostic::kind)
                        .containsExactly(DiagnosticKind.NO_COMPATIBLE_TOOL);
            } finally {
                release.countDown();
                executor.shutdownNow();
            }
        }
    }

    @Nested
    class FatalInput {

        @Test
        void shouldFailOnMissingLayoutReference() {
            FlowOrchestrator orchestrator = orchestrator(referenceTools());

            assertThatThrownBy(() -> orchestrator.plan(FlowRequest.of(referenceChanges())))
                    .isInstanceOfSatisfying(
                            FlowPlanningException.class,
                            e -> {
                                assertThat(e.getReason())
                                        .isEqualTo(FailureReason.MISSING_LAYOUT_REFERENCE);
                                assertThat(e.getOrderIndex()).isEqualTo(1);
                            });
            assertThat(events.get(events.size() - 1)).isInstanceOf(FlowEvent.FlowFailed.class);
            assertThat(events).noneMatch(e -> e instanceof FlowEvent.FlowCompleted);
        }

        @Test
        void shouldFailOnMalformedDescriptorBeforePlanningAnything() {
            ChangeDescriptor malformed =
                    removal(2, "SiO2", 0.2).toBuilder().primaryMaterial(null).build();
            List<ChangeDescriptor> changes =
                    List.of(addition(0, "SiO2", 2.0), patterning(1, "LITHO_STEP_2"), malformed);

            assertThatThrownBy(
                            () -> orchestrator(referenceTools()).plan(new FlowRequest(changes, LAYOUTS)))
                    .isInstanceOfSatisfying(
                            FlowPlanningException.class,
                            e -> {
                                assertThat(e.getReason()).isEqualTo(FailureReason.MALFORMED_DESCRIPTOR);
                                assertThat(e.getOrderIndex()).isEqualTo(2);
                                assertThat(e.getMessage()).contains("primary_material");
                            });
            assertThat(events).noneMatch(e -> e instanceof FlowEvent.StepEmitted);
        }

        @Test
        void shouldFailOnPatterningChangeWithPolarityButNoGeometry() {
            ChangeDescriptor polarized =
                    patterning(0, "LITHO_STEP_2").toBuilder().polarity(Polarity.ADDITION).build();

            assertThatThrownBy(
                            () ->
                                    orchestrator(referenceTools())
                                            .plan(new FlowRequest(List.of(polarized), LAYOUTS)))
                    .isInstanceOfSatisfying(
                            FlowPlanningException.class,
                            e -> {
                                assertThat(e.getReason()).isEqualTo(FailureReason.MALFORMED_DESCRIPTOR);
                                assertThat(e.getOrderIndex()).isZero();
                                assertThat(e.getMessage()).contains("target_metric");
                            });
            assertThat(events).noneMatch(e -> e instanceof FlowEvent.StepEmitted);
        }

        @Test
        void shouldFailOnDuplicateOrderIndex() {
            List<ChangeDescriptor> changes =
                    List.of(addition(0, "SiO2", 2.0), removal(0, "SiO2", 0.2));

            assertThatThrownBy(() -> orchestrator(referenceTools()).plan(FlowRequest.of(changes)))
                    .isInstanceOf(FlowPlanningException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        void shouldFailWhenSelectedToolLacksSurrogate() {
            ToolRecord bare =
                    new ToolRecord(
                            "CVD_01",
                            ToolStatus.AVAILABLE,
                            WaferSize.MM_300,
                            Set.of(ProcessCategory.DEPOSITION),
                            Set.of(),
                            null);

            assertThatThrownBy(
                            () ->
                                    orchestrator(List.of(bare))
                                            .plan(FlowRequest.of(List.of(addition(0, "SiO2", 2.0)))))
                    .isInstanceOfSatisfying(
                            FlowPlanningException.class,
                            e -> assertThat(e.getReason()).isEqualTo(FailureReason.INCOMPLETE_TOOL_RECORD));
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class CollaboratorOutages {

        @Mock private KnowledgeStore knowledgeStore;

        @Test
        void shouldAbortWhenKnowledgeStoreIsDown() throws Exception {
            when(knowledgeStore.findCandidateTools(any()))
                    .thenThrow(new KnowledgeStoreUnavailableException("connection refused"));
            FlowOrchestrator orchestrator =
                    orchestrator(knowledgeStore, MASKS, AuxiliaryStepPolicy.none());

            assertThatThrownBy(() -> orchestrator.plan(new FlowRequest(referenceChanges(), LAYOUTS)))
                    .isInstanceOfSatisfying(
                            CollaboratorUnavailableException.class,
                            e -> {
                                assertThat(e.getCollaborator()).isEqualTo(Collaborator.KNOWLEDGE_STORE);
                                assertThat(e.getOrderIndex()).isZero();
                                assertThat(e).hasCauseInstanceOf(KnowledgeStoreUnavailableException.class);
                            });
        }

        @Test
        void shouldAbortWhenMaskServiceIsDown() {
            MaskExtractor down =
                    (layout, stepId) -> {
                        throw new MaskServiceUnavailableException("gds service offline");
                    };
            FlowOrchestrator orchestrator =
                    orchestrator(new InMemoryKnowledgeStore(referenceTools()), down, AuxiliaryStepPolicy.none());

            assertThatThrownBy(() -> orchestrator.plan(new FlowRequest(referenceChanges(), LAYOUTS)))
                    .isInstanceOfSatisfying(
                            CollaboratorUnavailableException.class,
                            e -> assertThat(e.getCollaborator()).isEqualTo(Collaborator.MASK_SERVICE));
        }
    }

    @Nested
    class AuxiliarySteps {

        private final Map<String, String> layouts = Map.of("LITHO_STEP_2", LAYOUT);

        @Test
        void shouldInjectPatterningBeforeAnisotropicEtch() throws Exception {
            FlowOrchestrator orchestrator =
                    orchestrator(
                            new InMemoryKnowledgeStore(referenceTools()),
                            MASKS,
                            AuxiliaryStepPolicy.patterningBeforeAnisotropicEtch());
            List<ChangeDescriptor> changes = List.of(addition(0, "SiO2", 2.0), removal(1, "SiO2", 0.2));

            FlowResult result = orchestrator.plan(new FlowRequest(changes, layouts));

            assertThat(result.flow().steps())
                    .extracting(ProcessStep::processType)
                    .containsExactly("Deposition", "Lithography", "Etch");
            ProcessStep injected = result.flow().step(2);
            assertThat(injected.isInjected()).isTrue();
            assertThat(injected.recipeParameters().maskFile())
                    .contains("output/mask_LITHO_STEP_2.gds");
        }

        @Test
        void shouldNotInjectWithoutLayout() throws Exception {
            FlowOrchestrator orchestrator =
                    orchestrator(
                            new InMemoryKnowledgeStore(referenceTools()),
                            MASKS,
                            AuxiliaryStepPolicy.patterningBeforeAnisotropicEtch());
            List<ChangeDescriptor> changes = List.of(addition(0, "SiO2", 2.0), removal(1, "SiO2", 0.2));

            assertThat(orchestrator.plan(FlowRequest.of(changes)).flow().size()).isEqualTo(2);
        }

        @Test
        void shouldNotInjectAfterExplicitPatterning() throws Exception {
            FlowOrchestrator orchestrator =
                    orchestrator(
                            new InMemoryKnowledgeStore(referenceTools()),
                            MASKS,
                            AuxiliaryStepPolicy.patterningBeforeAnisotropicEtch());
            Map<String, String> both = Map.of("LITHO_STEP_2", LAYOUT, "LITHO_STEP_3", LAYOUT);

            FlowResult result = orchestrator.plan(new FlowRequest(referenceChanges(), both));

            assertThat(result.flow().size()).isEqualTo(3);
            assertThat(result.flow().steps()).noneMatch(ProcessStep::isInjected);
        }
    }

    @Nested
    class Observers {

        @Test
        void shouldIgnoreFailingObserver() throws Exception {
            FlowOrchestrator orchestrator = orchestrator(referenceTools());
            orchestrator.addObserver(
                    event -> {
                        throw new IllegalStateException("broken observer");
                    });

            FlowResult result = orchestrator.plan(new FlowRequest(referenceChanges(), LAYOUTS));

            assertThat(result.flow().size()).isEqualTo(3);
        }

        @Test
        void shouldAcceptLoggingObserver() throws Exception {
            FlowOrchestrator orchestrator = orchestrator(referenceTools());
            LoggingFlowObserver logging = new LoggingFlowObserver();
            orchestrator.addObserver(logging);

            orchestrator.plan(new FlowRequest(referenceChanges(), LAYOUTS));

            assertThat(orchestrator.removeObserver(logging)).isTrue();
            assertThat(orchestrator.getObservers()).hasSize(1);
        }
    }

    @Test
    void shouldRejectNullRequest() {
        assertThatThrownBy(() -> orchestrator(referenceTools()).plan(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("request must not be null");
    }
}
