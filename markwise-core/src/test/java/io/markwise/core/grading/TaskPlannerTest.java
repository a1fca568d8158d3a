package io.markwise.core.grading;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.error.ValidationException;
import io.markwise.core.model.GradeRequest;
import io.markwise.core.model.ModelPairSpec;
import io.markwise.core.model.ModelSpec;
import io.markwise.core.model.WorkItem;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TaskPlannerTest {

    private final TaskPlanner planner = new TaskPlanner();

    @Test
    void shouldPlanOneItemPerModelAndTry() {
        GradeRequest request = GradeRequest.forModels(
            "s1",
            List.of(new ModelSpec("openai/gpt-4o", 3, null, null), ModelSpec.of("google/gemini-2.5-pro")),
            2
        );

        List<WorkItem> items = planner.plan(request);

        assertThat(items).hasSize(5);
        assertThat(items).extracting(WorkItem::instanceId).containsExactly(
            "openai/gpt-4o", "openai/gpt-4o", "openai/gpt-4o", "google/gemini-2.5-pro", "google/gemini-2.5-pro"
        );
        assertThat(items).extracting(WorkItem::tryIndex).containsExactly(1, 2, 3, 1, 2);
        assertThat(items).allMatch(item -> !item.rubricConditioned());
    }

    @Test
    void shouldFallBackToRequestDefaultTriesPerModel() {
        GradeRequest request = GradeRequest.forModels(
            "s1",
            List.of(new ModelSpec("A", 2, null, null), ModelSpec.of("B")),
            3
        );

        List<WorkItem> items = planner.plan(request);

        assertThat(items).hasSize(5);
        assertThat(items).filteredOn(item -> item.assessmentModel().equals("A"))
            .extracting(WorkItem::tryIndex).containsExactly(1, 2);
        assertThat(items).filteredOn(item -> item.assessmentModel().equals("B"))
            .extracting(WorkItem::tryIndex).containsExactly(1, 2, 3);
    }

    @Test
    void shouldDefaultToSingleTryWhenNothingIsGiven() {
        List<WorkItem> items = planner.plan(GradeRequest.forModels("s1", List.of(ModelSpec.of("m")), null));

        assertThat(items).singleElement().satisfies(item -> assertThat(item.tryIndex()).isEqualTo(1));
    }

    @Test
    void shouldKeepExplicitInstanceIdForModels() {
        List<WorkItem> items = planner.plan(GradeRequest.forModels(
            "s1",
            List.of(new ModelSpec("m", 1, null, "m-strict")),
            null
        ));

        assertThat(items.get(0).instanceId()).isEqualTo("m-strict");
        assertThat(items.get(0).assessmentModel()).isEqualTo("m");
    }

    @Test
    void shouldNamePairsByIndexAndTakeTriesFromAssessmentLeg() {
        GradeRequest request = GradeRequest.forPairs(
            "s1",
            List.of(
                new ModelPairSpec(new ModelSpec("r1", 5, null, null), new ModelSpec("a1", 2, null, null), null),
                new ModelPairSpec(new ModelSpec("r2", 3, null, null), ModelSpec.of("a2"), "custom")
            ),
            1
        );

        List<WorkItem> items = planner.plan(request);

        assertThat(items).hasSize(5);
        assertThat(items.subList(0, 2)).allSatisfy(item -> {
            assertThat(item.instanceId()).isEqualTo("pair_0_r1_a1");
            assertThat(item.rubricModel()).isEqualTo("r1");
            assertThat(item.assessmentModel()).isEqualTo("a1");
        });
        assertThat(items.subList(2, 5)).extracting(WorkItem::instanceId).containsOnly("custom");
        assertThat(items.subList(2, 5)).extracting(WorkItem::tryIndex).containsExactly(1, 2, 3);
    }

    @Test
    void shouldRejectBothOrNeitherModelList() {
        GradeRequest both = new GradeRequest(
            "s1",
            List.of(new ModelPairSpec(ModelSpec.of("r"), ModelSpec.of("a"), null)),
            List.of(ModelSpec.of("m")),
            null,
            null
        );
        GradeRequest neither = new GradeRequest("s1", null, null, null, null);

        assertThatThrownBy(() -> planner.plan(both)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> planner.plan(neither)).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectPairWithMissingLeg() {
        GradeRequest request = GradeRequest.forPairs("s1", List.of(new ModelPairSpec(ModelSpec.of("r"), null, null)), 1);

        assertThatThrownBy(() -> planner.plan(request))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("model_pairs[0]");
    }

    @Test
    void shouldTreatEmptyReasoningAsAbsent() {
        Map<String, Object> requestLevel = Map.of("effort", "high");
        GradeRequest request = new GradeRequest(
            "s1",
            null,
            List.of(new ModelSpec("a", 1, Map.of(), null), new ModelSpec("b", 1, Map.of("effort", "low"), null)),
            null,
            requestLevel
        );

        List<WorkItem> items = planner.plan(request);

        assertThat(items.get(0).assessmentReasoning()).containsEntry("effort", "high");
        assertThat(items.get(1).assessmentReasoning()).containsEntry("effort", "low");
    }

    @Test
    void shouldIgnoreNonPositiveTries() {
        assertThat(TaskPlanner.effectiveTries(0, 3)).isEqualTo(3);
        assertThat(TaskPlanner.effectiveTries(-1, null)).isEqualTo(1);
        assertThat(TaskPlanner.effectiveTries(4, 2)).isEqualTo(4);
    }

    @Test
    void shouldKeepReasoningFieldsWithNullValues() throws Exception {
        GradeRequest request = new ObjectMapper().readValue("""
            {
              "session_id": "s1",
              "models": [{"name": "m", "reasoning": {"effort": "high", "max_tokens": null}}],
              "reasoning": {"exclude": null}
            }
            """, GradeRequest.class);

        List<WorkItem> items = planner.plan(request);

        assertThat(items).singleElement().satisfies(item -> assertThat(item.assessmentReasoning())
            .containsEntry("effort", "high")
            .containsKey("max_tokens"));
    }

    @Test
    void shouldFallBackToRequestReasoningWithNullValuesForPairs() throws Exception {
        GradeRequest request = new ObjectMapper().readValue("""
            {
              "session_id": "s1",
              "model_pairs": [{"rubric_model": {"name": "r"}, "assessment_model": {"name": "a"}}],
              "reasoning": {"exclude": null}
            }
            """, GradeRequest.class);

        List<WorkItem> items = planner.plan(request);

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.rubricReasoning()).containsOnlyKeys("exclude");
            assertThat(item.assessmentReasoning()).containsOnlyKeys("exclude");
        });
    }
}
