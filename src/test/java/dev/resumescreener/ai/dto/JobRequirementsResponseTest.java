package dev.resumescreener.ai.dto;

import dev.resumescreener.ai.OracleParseException;
import dev.resumescreener.model.Importance;
import dev.resumescreener.model.JobRequirement;
import dev.resumescreener.model.JobRequirements;
import dev.resumescreener.model.ScoreResult;
import dev.resumescreener.service.ScoreAggregationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobRequirementsResponseTest {

    private static JobRequirementsResponse.SkillSpec spec(String name, String importance, Double minYears) {
        return new JobRequirementsResponse.SkillSpec(name, importance, minYears, null);
    }

    private static JobRequirementsResponse response(List<JobRequirementsResponse.SkillSpec> core,
            List<JobRequirementsResponse.SkillSpec> secondary, List<JobRequirementsResponse.SkillSpec> niceToHave) {
        return new JobRequirementsResponse("Platform Engineer", core, secondary, niceToHave, null, null);
    }

    @Nested
    @DisplayName("Importance mapping")
    class ImportanceTests {

        @Test
        @DisplayName("Should keep a preferred core skill in the core set")
        void shouldKeepPreferredCoreSkillCore() {
            JobRequirements jd = response(List.of(spec("Kubernetes", "preferred", 3.0)), null, null)
                    .toRequirements();

            assertThat(jd.requirements()).singleElement()
                    .satisfies(r -> assertThat(r.getImportance()).isEqualTo(Importance.REQUIRED));
            assertThat(jd.coreRequirements()).hasSize(1);
        }

        @Test
        @DisplayName("Should not give a candidate without evidence a full core score for preferred core skills")
        void shouldScorePreferredCoreSkillAsUnmatched() {
            JobRequirements jd = response(List.of(spec("Kubernetes", "preferred", 3.0)), null, null)
                    .toRequirements();

            ScoreResult result = new ScoreAggregationService()
                    .aggregate(List.of(), jd.requirements(), 0.0, 0.0, false, false);

            assertThat(result.totalCoreSkills()).isEqualTo(1);
            assertThat(result.coreSkillsScore()).isEqualTo(0.0);
            assertThat(result.overallScore()).isEqualTo(25);
        }

        @Test
        @DisplayName("Should treat unknown secondary labels as required and keep critical")
        void shouldMapSecondaryLabels() {
            JobRequirements jd = response(null,
                    List.of(spec("Terraform", "important", null), spec("Go", "critical", 2.0)), null)
                    .toRequirements();

            assertThat(jd.requirements()).extracting(JobRequirement::getImportance)
                    .containsExactly(Importance.REQUIRED, Importance.CRITICAL);
        }

        @Test
        @DisplayName("Should keep nice-to-have skills out of the core set whatever their label")
        void shouldKeepNiceToHaveOutOfCore() {
            JobRequirements jd = response(null, null,
                    List.of(spec("Helm", "required", null), spec("ArgoCD", "critical", null)))
                    .toRequirements();

            assertThat(jd.requirements()).extracting(JobRequirement::getImportance)
                    .containsOnly(Importance.NICE_TO_HAVE);
            assertThat(jd.coreRequirements()).isEmpty();
        }

        @Test
        @DisplayName("Should keep the first occurrence of a duplicated skill")
        void shouldKeepFirstOccurrence() {
            JobRequirements jd = response(List.of(spec("Java", "critical", 5.0)), null,
                    List.of(spec("java", null, null)))
                    .toRequirements();

            assertThat(jd.requirements()).singleElement()
                    .satisfies(r -> assertThat(r.getImportance()).isEqualTo(Importance.CRITICAL));
        }
    }

    @Nested
    @DisplayName("validate()")
    class ValidateTests {

        @Test
        @DisplayName("Should reject negative min_years")
        void shouldRejectNegativeMinYears() {
            JobRequirementsResponse response = response(List.of(spec("Java", "required", -1.0)), null, null);

            assertThatThrownBy(response::validate)
                    .isInstanceOf(OracleParseException.class)
                    .hasMessageContaining("Java");
        }

        @Test
        @DisplayName("Should reject a response without skill lists")
        void shouldRejectMissingLists() {
            assertThatThrownBy(response(null, null, null)::validate)
                    .isInstanceOf(OracleParseException.class);
        }
    }
}
