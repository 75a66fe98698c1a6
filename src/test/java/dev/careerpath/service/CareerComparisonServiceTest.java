package dev.careerpath.service;

import dev.careerpath.config.ComparisonConfig;
import dev.careerpath.data.InMemoryReferenceDataStore;
import dev.careerpath.exception.NotFoundException;
import dev.careerpath.exception.ValidationException;
import dev.careerpath.model.Career;
import dev.careerpath.model.RealityCheck;
import dev.careerpath.model.RealityCheckEntry;
import dev.careerpath.model.RealityCheckTable;
import dev.careerpath.service.CareerComparisonService.CareerMetrics;
import dev.careerpath.service.CareerComparisonService.ComparisonReport;
import dev.careerpath.service.CareerComparisonService.DetailedComparison;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CareerComparisonServiceTest {

    private CareerComparisonService service;

    @BeforeEach
    void setUp() {
        Career engineer = Career.builder()
                .name("Software Engineer")
                .requiredSkills(List.of("programming", "problem_solving", "logical_thinking", "mathematics"))
                .medianSalary("$110,000")
                .growthRate("22% (much faster than average)")
                .jobOutlook("Excellent")
                .build();
        Career teacher = Career.builder()
                .name("Teacher")
                .requiredSkills(List.of("communication", "patience"))
                .medianSalary("$61,000")
                .growthRate("4%")
                .build();
        Career designer = Career.builder()
                .name("Graphic Designer")
                .requiredSkills(List.of("creativity", "design", "typography", "software", "communication", "branding"))
                .medianSalary("$50,000-$70,000")
                .growthRate("3%")
                .build();
        Career engineerIndia = engineer.toBuilder().medianSalary("₹8-15 LPA").jobOutlook("Very high demand").build();
        Career iasOfficer = Career.builder()
                .name("IAS Officer")
                .requiredSkills(List.of("leadership", "public_administration"))
                .medianSalary("₹10-15 LPA")
                .growthRate("Stable")
                .build();

        RealityCheckTable realityChecks = RealityCheckTable.builder()
                .careerRealityData(Map.of(
                        "Software Engineer", RealityCheckEntry.builder()
                                .realityCheck(RealityCheck.builder()
                                        .stressLevel("Medium-High")
                                        .workLifeBalance("Good with flexible hours")
                                        .build())
                                .build(),
                        "Teacher", RealityCheckEntry.builder()
                                .realityCheck(RealityCheck.builder()
                                        .stressLevel("High")
                                        .workLifeBalance("Challenging during exam season")
                                        .build())
                                .build()))
                .build();

        InMemoryReferenceDataStore store = InMemoryReferenceDataStore.builder()
                .regionCareers("global", List.of(engineer, teacher, designer))
                .regionCareers("india", List.of(engineerIndia, iasOfficer))
                .realityChecks(realityChecks)
                .build();

        service = new CareerComparisonService(store, new ComparisonConfig());
    }

    @Nested
    @DisplayName("Available careers")
    class AvailableCareersTests {

        @Test
        @DisplayName("Should list every catalog career for all regions")
        void shouldListAll() {
            assertThat(service.availableCareers("all"))
                    .containsExactly("Software Engineer", "Teacher", "Graphic Designer", "IAS Officer");
        }

        @Test
        @DisplayName("Should list careers offered in a region, sorted")
        void shouldListRegion() {
            assertThat(service.availableCareers("india")).containsExactly("IAS Officer", "Software Engineer");
            assertThat(service.availableCareers("global"))
                    .containsExactly("Graphic Designer", "Software Engineer", "Teacher");
        }

        @Test
        @DisplayName("Should reject an unknown region")
        void shouldRejectUnknownRegion() {
            assertThatThrownBy(() -> service.availableCareers("mars"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("mars");
        }
    }

    @Nested
    @DisplayName("Comparison")
    class ComparisonTests {

        @Test
        @DisplayName("Should build metrics and rankings for each career")
        void shouldCompare() {
            ComparisonReport report = service.compare(
                    List.of("Software Engineer", "Teacher", "Graphic Designer"), "global");

            CareerMetrics engineer = report.careers().get(0);
            assertThat(engineer.salaryNumeric()).isEqualTo(110_000);
            assertThat(engineer.stressScore()).isEqualTo(4);
            assertThat(engineer.workLifeScore()).isEqualTo(4);
            assertThat(engineer.growthNumeric()).isEqualTo(22.0);
            assertThat(engineer.skillsComplexity()).isEqualTo(2);

            CareerMetrics designer = report.careers().get(2);
            assertThat(designer.stressLevel()).isEqualTo("Medium");
            assertThat(designer.workLifeBalance()).isEqualTo("Moderate");
            assertThat(designer.salaryNumeric()).isEqualTo(60_000);
            assertThat(designer.description()).isEmpty();
            assertThat(designer.jobOutlook()).isEqualTo("N/A");

            assertThat(report.rankings()).containsOnlyKeys(
                    "salary", "stress_level", "work_life_balance", "growth_rate", "skills_complexity");
            assertThat(report.rankings().get("salary"))
                    .containsExactly("Software Engineer", "Teacher", "Graphic Designer");
            assertThat(report.rankings().get("stress_level"))
                    .containsExactly("Graphic Designer", "Software Engineer", "Teacher");
            assertThat(report.rankings().get("work_life_balance"))
                    .containsExactly("Software Engineer", "Graphic Designer", "Teacher");
            assertThat(report.rankings().get("growth_rate"))
                    .containsExactly("Software Engineer", "Teacher", "Graphic Designer");
            assertThat(report.rankings().get("skills_complexity"))
                    .containsExactly("Teacher", "Software Engineer", "Graphic Designer");
        }

        @Test
        @DisplayName("Should use the regional salary overlay")
        void shouldUseRegionalSalary() {
            ComparisonReport report = service.compare(List.of("Software Engineer", "IAS Officer"), "india");

            assertThat(report.careers().get(0).salary()).isEqualTo("₹8-15 LPA");
            assertThat(report.careers().get(0).salaryNumeric()).isEqualTo(1_150_000);
            assertThat(report.careers().get(1).salaryNumeric()).isEqualTo(1_250_000);
            assertThat(report.rankings().get("salary")).containsExactly("IAS Officer", "Software Engineer");
            assertThat(report.region()).isEqualTo("india");
        }

        @Test
        @DisplayName("Should resolve career names case-insensitively")
        void shouldResolveIgnoringCase() {
            ComparisonReport report = service.compare(List.of("software engineer", "TEACHER"), "global");

            assertThat(report.careers()).extracting(CareerMetrics::name)
                    .containsExactly("Software Engineer", "Teacher");
            assertThat(report.rankings().values())
                    .allSatisfy(ranking -> assertThat(ranking)
                            .containsExactlyInAnyOrder("Software Engineer", "Teacher"));
        }

        @Test
        @DisplayName("Should reject fewer than two or more than five careers")
        void shouldEnforceBounds() {
            assertThatThrownBy(() -> service.compare(List.of("Teacher"), "global"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Please select at least 2 careers to compare");
            assertThatThrownBy(() -> service.compare(List.of("a", "b", "c", "d", "e", "f"), "global"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Maximum 5 careers can be compared at once");
        }

        @Test
        @DisplayName("Should report unknown careers with the available names")
        void shouldRejectUnknownCareer() {
            assertThatThrownBy(() -> service.compare(List.of("Teacher", "Astronaut"), "global"))
                    .hasMessageContaining("Astronaut")
                    .isInstanceOfSatisfying(NotFoundException.class,
                            e -> assertThat(e.getAvailableKeys()).contains("Teacher"));
        }
    }

    @Nested
    @DisplayName("Detailed comparison")
    class DetailedComparisonTests {

        @Test
        @DisplayName("Should name the winner of each dimension")
        void shouldPickWinners() {
            DetailedComparison detailed = service.compareDetailed("Software Engineer", "Teacher", "global");

            assertThat(detailed.winnerAnalysis())
                    .containsEntry("salary", "Software Engineer")
                    .containsEntry("work_life_balance", "Software Engineer")
                    .containsEntry("low_stress", "Software Engineer")
                    .containsEntry("growth_potential", "Software Engineer")
                    .containsEntry("easier_entry", "Teacher");
        }

        @Test
        @DisplayName("Should give ties to the second career")
        void shouldGiveTiesToSecond() {
            DetailedComparison detailed = service.compareDetailed("Software Engineer", "Software Engineer", "global");

            assertThat(detailed.winnerAnalysis().values()).containsOnly("Software Engineer");
            assertThat(detailed.careerA()).isEqualTo(detailed.careerB());
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "$110,000 | 110000",
            "$50,000-$70,000 | 60000",
            "$80k - $120k | 100000",
            "12 lakh | 1200000",
            "₹8-15 LPA | 1150000",
            "1.5 crore | 15000000",
            "8 to 10 LPA | 900000",
            "N/A | 0",
            "Varies | 0"
    })
    void normalizeSalary_parsesCommonFormats(String salary, long expected) {
        assertThat(CareerComparisonService.normalizeSalary(salary)).isEqualTo(expected);
    }

    @Test
    void normalizeSalary_blankIsZero() {
        assertThat(CareerComparisonService.normalizeSalary(null)).isZero();
        assertThat(CareerComparisonService.normalizeSalary("  ")).isZero();
    }
}
