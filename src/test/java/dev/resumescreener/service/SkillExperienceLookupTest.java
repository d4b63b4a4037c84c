package dev.resumescreener.service;

import dev.resumescreener.ai.OracleException;
import dev.resumescreener.model.Importance;
import dev.resumescreener.model.JobBreakdown;
import dev.resumescreener.model.JobRequirement;
import dev.resumescreener.model.SkillExperience;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SkillExperienceLookupTest {

    @Mock
    private OracleExtractionService extractionService;

    private SkillExperienceLookup lookup;

    private Map<String, SkillExperience> experienceMap;

    @BeforeEach
    void setUp() {
        lookup = new SkillExperienceLookup(new ExperienceAggregationService(), extractionService);

        experienceMap = new LinkedHashMap<>();
        experienceMap.put("Java", new SkillExperience("Java", 5.0,
                List.of(new JobBreakdown("Acme", 36, ""), new JobBreakdown("Globex", 24, ""))));
        experienceMap.put("PostgreSQL", new SkillExperience("PostgreSQL", 2.0,
                List.of(new JobBreakdown("Acme", 24, ""))));
        experienceMap.put("MySQL", new SkillExperience("MySQL", 3.0,
                List.of(new JobBreakdown("Globex", 36, ""))));
        experienceMap.put("ASP.NET Core", new SkillExperience("ASP.NET Core", 1.0,
                List.of(new JobBreakdown("Initech", 12, ""))));
    }

    private static JobRequirement requirement(String name, String... variants) {
        JobRequirement.JobRequirementBuilder builder = JobRequirement.builder()
                .skillName(name).importance(Importance.REQUIRED).minYears(2);
        for (String variant : variants) {
            builder.nameVariant(variant);
        }
        return builder.build();
    }

    @Test
    @DisplayName("Should find an exact skill name")
    void shouldFindExactName() {
        StepVerifier.create(lookup.lookup(requirement("Java"), experienceMap))
                .assertNext(exp -> assertThat(exp.totalYears()).isEqualTo(5.0))
                .verifyComplete();

        verifyNoInteractions(extractionService);
    }

    @Test
    @DisplayName("Should find a skill name ignoring case and report it under the requirement's name")
    void shouldFindNameIgnoringCase() {
        StepVerifier.create(lookup.lookup(requirement("postgresql"), experienceMap))
                .assertNext(exp -> {
                    assertThat(exp.skillName()).isEqualTo("postgresql");
                    assertThat(exp.totalYears()).isEqualTo(2.0);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should merge name variants without double counting a company")
    void shouldMergeVariants() {
        StepVerifier.create(lookup.lookup(requirement("SQL", "PostgreSQL", "mysql", "Oracle"), experienceMap))
                .assertNext(exp -> {
                    assertThat(exp.skillName()).isEqualTo("SQL");
                    assertThat(exp.totalYears()).isEqualTo(5.0);
                    assertThat(exp.jobBreakdown()).extracting(JobBreakdown::company)
                            .containsExactlyInAnyOrder("Acme", "Globex");
                })
                .verifyComplete();

        verifyNoInteractions(extractionService);
    }

    @Test
    @DisplayName("Should ask the oracle which resume skills count when nothing matches by name")
    void shouldFallBackToOracle() {
        when(extractionService.matchSkillVariants(eq(".NET"), anyDouble(), any()))
                .thenReturn(Mono.just(List.of("ASP.NET Core", "Unknown Skill")));

        StepVerifier.create(lookup.lookup(requirement(".NET"), experienceMap))
                .assertNext(exp -> {
                    assertThat(exp.skillName()).isEqualTo(".NET");
                    assertThat(exp.totalYears()).isEqualTo(1.0);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should assume no experience when the oracle matches nothing")
    void shouldReturnEmptyWhenOracleMatchesNothing() {
        when(extractionService.matchSkillVariants(eq("Rust"), anyDouble(), any())).thenReturn(Mono.just(List.of()));

        StepVerifier.create(lookup.lookup(requirement("Rust"), experienceMap))
                .assertNext(exp -> {
                    assertThat(exp.totalYears()).isEqualTo(0.0);
                    assertThat(exp.jobBreakdown()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should assume no experience when the oracle fails")
    void shouldReturnEmptyWhenOracleFails() {
        when(extractionService.matchSkillVariants(eq("Rust"), anyDouble(), any()))
                .thenReturn(Mono.error(new OracleException("provider down")));

        StepVerifier.create(lookup.lookup(requirement("Rust"), experienceMap))
                .assertNext(exp -> assertThat(exp.totalYears()).isEqualTo(0.0))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should not call the oracle for an empty experience map")
    void shouldShortCircuitEmptyMap() {
        StepVerifier.create(lookup.lookup(requirement("Java"), Map.of()))
                .assertNext(exp -> assertThat(exp).isEqualTo(SkillExperience.empty("Java")))
                .verifyComplete();

        verifyNoInteractions(extractionService);
    }
}
