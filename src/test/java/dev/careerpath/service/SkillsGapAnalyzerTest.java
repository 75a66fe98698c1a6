package dev.careerpath.service;

import dev.careerpath.config.GapAnalysisConfig;
import dev.careerpath.data.InMemoryReferenceDataStore;
import dev.careerpath.model.Career;
import dev.careerpath.model.LearningResource;
import dev.careerpath.model.SkillTaxonomy;
import dev.careerpath.service.SkillsGapAnalyzer.DevelopmentPlan;
import dev.careerpath.service.SkillsGapAnalyzer.LearningStep;
import dev.careerpath.service.SkillsGapAnalyzer.SkillsGapReport;
import dev.careerpath.service.SkillsGapAnalyzer.TimeEstimate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SkillsGapAnalyzerTest {

    private SkillsGapAnalyzer analyzer;

    private final Career dataScientist = Career.builder()
            .name("Data Scientist")
            .requiredSkills(List.of("Machine Learning", "programming", "statistics", "communication", "data_visualization"))
            .build();

    @BeforeEach
    void setUp() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("technical", List.of("programming", "machine_learning", "statistics"));
        categories.put("soft", List.of("communication"));

        SkillTaxonomy taxonomy = SkillTaxonomy.builder()
                .subjectsToSkills(Map.of("mathematics", List.of("Statistics")))
                .skillCategories(categories)
                .learningResources(Map.of("machine_learning", LearningResource.builder()
                        .beginner(List.of("Intro to ML"))
                        .timeEstimate("6 months")
                        .build()))
                .build();

        analyzer = new SkillsGapAnalyzer(InMemoryReferenceDataStore.builder().taxonomy(taxonomy).build(),
                new GapAnalysisConfig());
    }

    @Nested
    @DisplayName("Skill matching")
    class SkillMatchingTests {

        @Test
        @DisplayName("Should normalise both sides before comparing")
        void shouldNormaliseBothSides() {
            SkillsGapReport report = analyzer.analyze(List.of("Programming", "machine learning"), dataScientist, List.of());

            assertThat(report.currentSkills().skills()).containsExactly("machine_learning", "programming");
            assertThat(report.missingSkills().skills())
                    .containsExactly("statistics", "communication", "data_visualization");
            assertThat(report.skillMatchPercentage()).isEqualTo(40.0);
        }

        @Test
        @DisplayName("Should count skills derived from subjects as owned")
        void shouldUseSubjectSkills() {
            SkillsGapReport report = analyzer.analyze(List.of(), dataScientist, List.of("Mathematics"));

            assertThat(report.currentSkills().skills()).containsExactly("statistics");
            assertThat(report.skillMatchPercentage()).isEqualTo(20.0);
        }

        @Test
        @DisplayName("Should report a full match when the user covers every required skill")
        void shouldReportFullMatchForSuperset() {
            SkillsGapReport report = analyzer.analyze(
                    List.of("machine learning", "programming", "statistics", "communication",
                            "data visualization", "cooking"),
                    dataScientist, List.of());

            assertThat(report.skillMatchPercentage()).isEqualTo(100.0);
            assertThat(report.missingSkills().skills()).isEmpty();
            assertThat(report.currentSkills().count()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should report no match when the user shares no required skill")
        void shouldReportZeroForDisjointSkills() {
            SkillsGapReport report = analyzer.analyze(List.of("cooking", "gardening"), dataScientist, List.of());

            assertThat(report.skillMatchPercentage()).isZero();
            assertThat(report.currentSkills().skills()).isEmpty();
            assertThat(report.missingSkills().count()).isEqualTo(5);
        }

        @ParameterizedTest
        @CsvSource({
                "''",
                "programming",
                "Machine Learning;communication;cooking",
                "statistics;data_visualization;programming;communication;machine_learning"
        })
        @DisplayName("Should split the required skills into disjoint current and missing parts")
        void shouldPartitionRequiredSkills(String skills) {
            List<String> userSkills = skills.isEmpty() ? List.of() : List.of(skills.split(";"));

            SkillsGapReport report = analyzer.analyze(userSkills, dataScientist, List.of());

            Set<String> required = new HashSet<>();
            dataScientist.requiredSkills().forEach(skill -> required.add(analyzer.normalize(skill)));
            Set<String> union = new HashSet<>(report.currentSkills().skills());
            union.addAll(report.missingSkills().skills());
            Set<String> overlap = new HashSet<>(report.currentSkills().skills());
            overlap.retainAll(report.missingSkills().skills());

            assertThat(union).isEqualTo(required);
            assertThat(overlap).isEmpty();
        }

        @Test
        @DisplayName("Should report full readiness for a career without required skills")
        void shouldHandleCareerWithoutSkills() {
            Career empty = Career.builder().name("Volunteer").build();

            SkillsGapReport report = analyzer.analyze(List.of("programming"), empty, List.of());

            assertThat(report.skillMatchPercentage()).isEqualTo(100.0);
            assertThat(report.readinessLevel().level()).isEqualTo("Ready");
            assertThat(report.timeEstimate().total()).isEqualTo("0 months");
            assertThat(report.skillDevelopmentPlan().message()).isEqualTo("No skill development needed - you're ready!");
            assertThat(report.skillDevelopmentPlan().phases()).isEmpty();
        }

        @Test
        @DisplayName("Should round the match percentage to one decimal")
        void shouldRoundPercentage() {
            Career three = Career.builder().name("Three").requiredSkills(List.of("a", "b", "c")).build();

            assertThat(analyzer.analyze(List.of("a"), three, List.of()).skillMatchPercentage()).isEqualTo(33.3);
            assertThat(analyzer.analyze(List.of("a", "b"), three, List.of()).skillMatchPercentage()).isEqualTo(66.7);
        }
    }

    @Nested
    @DisplayName("Categories and priorities")
    class CategoryTests {

        @Test
        @DisplayName("Should put each skill in the first matching category or other")
        void shouldCategorise() {
            SkillsGapReport report = analyzer.analyze(List.of(), dataScientist, List.of());

            Map<String, List<String>> categories = report.missingSkills().categories();
            assertThat(categories).containsOnlyKeys("technical", "soft", "other");
            assertThat(categories.get("technical")).containsExactly("machine_learning", "programming", "statistics");
            assertThat(categories.get("soft")).containsExactly("communication");
            assertThat(categories.get("other")).containsExactly("data_visualization");
        }

        @Test
        @DisplayName("Should fall back to configured categories when the taxonomy has none")
        void shouldUseFallbackCategories() {
            SkillsGapAnalyzer bare = new SkillsGapAnalyzer(InMemoryReferenceDataStore.builder().build(),
                    new GapAnalysisConfig());

            Map<String, List<String>> categories = bare.categorize(List.of("project_management", "cooking"));

            assertThat(categories).containsKeys("technical", "soft", "business", "other");
            assertThat(categories.get("business")).containsExactly("project_management");
            assertThat(categories.get("other")).containsExactly("cooking");
        }

        @Test
        @DisplayName("Should split missing skills into priority tiers")
        void shouldPrioritise() {
            SkillsGapAnalyzer.Priorities priorities =
                    analyzer.prioritize(List.of("machine_learning", "brand_strategy", "statistics"));

            assertThat(priorities.high()).containsExactly("machine_learning");
            assertThat(priorities.medium()).containsExactly("brand_strategy");
            assertThat(priorities.low()).containsExactly("statistics");
        }
    }

    @Nested
    @DisplayName("Learning plan")
    class LearningPlanTests {

        @Test
        @DisplayName("Should use taxonomy resources and fall back to generic ones")
        void shouldBuildLearningPath() {
            List<LearningStep> path = analyzer.learningPath(List.of("machine_learning", "pottery"));

            assertThat(path).hasSize(2);
            assertThat(path.get(0).resources().beginner()).containsExactly("Intro to ML");
            assertThat(path.get(1).resources().timeEstimate()).isEqualTo("2-4 months");
            assertThat(path.get(1).resources().beginner()).contains("Online courses for pottery");
            assertThat(path).allMatch(step -> step.difficulty().equals("beginner"));
        }

        @Test
        @DisplayName("Should estimate time assuming parallel learning")
        void shouldEstimateTime() {
            // 6 + 3 + 2 = 11, halved to 5
            TimeEstimate estimate = analyzer.estimateTime(List.of("programming", "design", "statistics"));

            assertThat(estimate.total()).isEqualTo("5 months");
            assertThat(estimate.breakdown())
                    .containsExactly("programming: 6 months", "design: 3 months", "statistics: 2 months");
        }

        @Test
        @DisplayName("Should never estimate less than the minimum")
        void shouldApplyMinimum() {
            assertThat(analyzer.estimateTime(List.of("statistics")).total()).isEqualTo("3 months");
        }

        @Test
        @DisplayName("Should fill development phases by position")
        void shouldFillPhases() {
            DevelopmentPlan plan = SkillsGapAnalyzer.developmentPlan(List.of("a", "b", "c", "d", "e"));

            assertThat(plan.message()).isNull();
            assertThat(plan.phases()).hasSize(3);
            assertThat(plan.phases().get(0).skills()).containsExactly("a", "b");
            assertThat(plan.phases().get(1).skills()).containsExactly("c", "d");
            assertThat(plan.phases().get(2).skills()).containsExactly("e");
        }

        @Test
        @DisplayName("Should mention the first two missing skills in early-stage next steps")
        void shouldBuildEarlyStageSteps() {
            List<String> steps = SkillsGapAnalyzer.nextSteps(List.of("statistics", "programming"), 20.0);

            assertThat(steps).hasSize(5);
            assertThat(steps.get(0)).isEqualTo("Start learning statistics immediately");
            assertThat(steps.get(4)).isEqualTo("Plan to learn programming after mastering the first skill");
        }
    }

    @ParameterizedTest
    @CsvSource({
            "100.0, Ready",
            "80.0, Ready",
            "79.9, Nearly Ready",
            "60.0, Nearly Ready",
            "40.0, Developing",
            "39.9, Early Stage",
            "0.0, Early Stage"
    })
    void readiness_followsThresholds(double percentage, String level) {
        assertThat(SkillsGapAnalyzer.readiness(percentage).level()).isEqualTo(level);
    }
}
