package dev.careerpath.service;

import dev.careerpath.config.AdvisorProperties;
import dev.careerpath.data.InMemoryReferenceDataStore;
import dev.careerpath.model.CareerTip;
import dev.careerpath.model.RoleModel;
import dev.careerpath.service.RoleModelService.Inspiration;
import dev.careerpath.service.RoleModelService.RegionalAdvice;
import dev.careerpath.service.RoleModelService.SkillTip;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RoleModelServiceTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-03-14T10:00:00Z"), ZoneOffset.UTC);

    private RoleModelService service;
    private AdvisorProperties properties;

    private final RoleModel engineer = RoleModel.builder()
            .name("Ada Lovelace")
            .career("Software Engineer")
            .title("First programmer")
            .keySkills(List.of("mathematics", "programming"))
            .inspirationQuote("Imagination is the discovering faculty")
            .advice("Study the fundamentals")
            .careerPath(List.of("Mathematician", "Programmer"))
            .build();
    private final RoleModel scientist = RoleModel.builder()
            .name("Grace Hopper")
            .career("Data Scientist")
            .title("Rear Admiral")
            .keySkills(List.of("compilers"))
            .inspirationQuote("It's easier to ask forgiveness")
            .build();
    private final RoleModel doctor = RoleModel.builder()
            .name("Anandi Gopal Joshi")
            .career("Doctor")
            .title("Physician")
            .regionalContext("First Indian woman to earn a medical degree abroad")
            .advice("Persist against the odds")
            .build();

    private final List<CareerTip> tips = List.of(
            CareerTip.builder().id(1).title("Build a portfolio").tip("Show your programming projects")
                    .category("skill_development").careerFocus(List.of("Software Engineer")).build(),
            CareerTip.builder().id(2).title("Network early").tip("Meet people in your field")
                    .category("networking").careerFocus(List.of("All careers")).build(),
            CareerTip.builder().id(3).title("Lead a project").tip("Take ownership of a small team effort")
                    .category("leadership").careerFocus(List.of("Project Manager")).build(),
            CareerTip.builder().id(4).title("Keep learning").tip("Statistics never goes out of date")
                    .category("skill_development").careerFocus(List.of("Data Scientist")).build());

    @BeforeEach
    void setUp() {
        properties = new AdvisorProperties();
        service = new RoleModelService(InMemoryReferenceDataStore.builder()
                .regionRoleModels("global", List.of(engineer, scientist))
                .regionRoleModels("india", List.of(doctor))
                .tips(tips)
                .build(), properties, FIXED);
    }

    @Nested
    @DisplayName("Role models")
    class RoleModelTests {

        @Test
        @DisplayName("Should match careers by containment ignoring case")
        void shouldMatchCareer() {
            assertThat(service.forCareer("global", "software engineer")).containsExactly(engineer);
            assertThat(service.forCareer("global", "Senior Data Scientist")).containsExactly(scientist);
        }

        @Test
        @DisplayName("Should fall back to every role model of the region")
        void shouldFallBackToRegion() {
            assertThat(service.forCareer("global", "Chef")).containsExactly(engineer, scientist);
            assertThat(service.forCareer("mars", "Chef")).isEmpty();
        }

        @Test
        @DisplayName("Should not repeat people across careers")
        void shouldDeduplicate() {
            List<RoleModel> models = service.forCareers("global",
                    List.of("Software Engineer", "Chef", "Data Scientist"));

            assertThat(models).containsExactly(engineer, scientist);
        }

        @Test
        @DisplayName("Should cap the number of role models")
        void shouldCap() {
            properties.setRoleModelLimit(1);

            assertThat(service.forCareers("global", List.of("Chef"))).containsExactly(engineer);
        }

        @Test
        @DisplayName("Should search names, careers, titles and skills")
        void shouldSearch() {
            assertThat(service.search("global", "COMPILERS")).containsExactly(scientist);
            assertThat(service.search("global", "admiral")).containsExactly(scientist);
            assertThat(service.search("global", "ada")).containsExactly(engineer);
            assertThat(service.search("global", "astronaut")).isEmpty();
        }

        @Test
        @DisplayName("Should quote a role model of the career")
        void shouldInspire() {
            Inspiration inspiration = service.inspiration("global", "Software Engineer");

            assertThat(inspiration.author()).isEqualTo("Ada Lovelace");
            assertThat(inspiration.quote()).isEqualTo("Imagination is the discovering faculty");
            assertThat(service.inspiration("mars", null)).isNull();
        }

        @Test
        @DisplayName("Should give regional advice from role models with regional context")
        void shouldGiveRegionalAdvice() {
            List<RegionalAdvice> advice = service.regionSpecificAdvice("india", "Doctor");

            assertThat(advice).hasSize(1);
            assertThat(advice.get(0).context()).startsWith("First Indian woman");
            assertThat(service.regionSpecificAdvice("global", "Software Engineer")).isEmpty();
        }

        @Test
        @DisplayName("Should describe a career path example")
        void shouldDescribeCareerPath() {
            assertThat(service.careerPathExample("global", "Software Engineer").careerPath())
                    .containsExactly("Mathematician", "Programmer");
        }
    }

    @Nested
    @DisplayName("Tips")
    class TipTests {

        @Test
        @DisplayName("Should give a known user the same tip all day")
        void shouldGiveStableDailyTip() {
            CareerTip first = service.dailyTip("Software Engineer", "user-42", "student");
            CareerTip second = service.dailyTip("Software Engineer", "user-42", "student");

            assertThat(first).isEqualTo(second);
            assertThat(first.id()).isIn(1, 2);
            int index = RoleModelService.stableIndex("user-42", LocalDate.of(2026, 3, 14), 2);
            assertThat(first).isEqualTo(List.of(tips.get(0), tips.get(1)).get(index));
        }

        @Test
        @DisplayName("Should keep the stable index within bounds")
        void shouldBoundStableIndex() {
            for (int size = 1; size <= 7; size++) {
                assertThat(RoleModelService.stableIndex("someone", LocalDate.of(2026, 1, 1), size))
                        .isBetween(0, size - 1);
            }
        }

        @Test
        @DisplayName("Should only offer professional categories to professionals")
        void shouldFilterProfessionalTips() {
            CareerTip tip = service.dailyTip(null, "user-42", "professional");

            assertThat(tip.category()).isIn("networking", "leadership");
        }

        @Test
        @DisplayName("Should narrow tips to the career focus and professional categories")
        void shouldNarrowToFocusAndCategory() {
            CareerTip tip = service.dailyTip("Software Engineer", "user-42", "professional");

            // only the networking tip applies to all careers and is a professional category
            assertThat(tip.id()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should fall back to every tip when none is relevant")
        void shouldFallBackToAllTips() {
            RoleModelService narrow = new RoleModelService(InMemoryReferenceDataStore.builder()
                    .tips(List.of(tips.get(0)))
                    .build(), properties, FIXED);

            assertThat(narrow.dailyTip("Chef", null, "student")).isEqualTo(tips.get(0));
        }

        @Test
        @DisplayName("Should return null when there are no tips at all")
        void shouldReturnNullWithoutTips() {
            RoleModelService empty = new RoleModelService(InMemoryReferenceDataStore.builder().build(),
                    properties, FIXED);

            assertThat(empty.dailyTip(null, "user-42", "student")).isNull();
        }

        @Test
        @DisplayName("Should return distinct weekly tips up to the configured count")
        void shouldReturnWeeklyTips() {
            properties.setWeeklyTipCount(3);

            List<CareerTip> weekly = service.weeklyTips(null, "student");

            assertThat(weekly).hasSize(3).doesNotHaveDuplicates();
            assertThat(tips).containsAll(weekly);
        }

        @Test
        @DisplayName("Should filter tips by category")
        void shouldFilterByCategory() {
            assertThat(service.tipsByCategory("skill_development")).extracting(CareerTip::id).containsExactly(1, 4);
        }

        @Test
        @DisplayName("Should match skill tips on title or text")
        void shouldMatchSkillTips() {
            List<SkillTip> matches = service.skillDevelopmentTips(new ArrayList<>(List.of("programming", "statistics")));

            assertThat(matches).extracting(match -> match.tip().id()).containsExactly(1, 4);
            assertThat(matches.get(0).skill()).isEqualTo("programming");
        }
    }
}
