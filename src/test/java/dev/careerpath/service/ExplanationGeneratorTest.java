package dev.careerpath.service;

import dev.careerpath.dto.RecommendationRequest;
import dev.careerpath.model.Career;
import dev.careerpath.model.Personality;
import dev.careerpath.service.ExplanationGenerator.Explanation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExplanationGeneratorTest {

    private final ExplanationGenerator generator = new ExplanationGenerator();

    private final Career softwareEngineer = Career.builder()
            .name("Software Engineer")
            .requiredSkills(List.of("programming", "problem_solving", "logical_thinking", "mathematics"))
            .interests(List.of("technology", "computers", "innovation", "problem_solving"))
            .subjects(List.of("computer_science", "mathematics", "physics"))
            .personalityTraits(List.of("analytical", "detail_oriented", "logical"))
            .build();

    @Test
    void explain_strongCandidate_listsStrengthsAndGaps() {
        RecommendationRequest request = RecommendationRequest.builder()
                .interests(List.of("technology", "computers", "innovation"))
                .skills(List.of("programming", "mathematics", "logical_thinking"))
                .subjects(List.of("computer_science", "mathematics"))
                .personality(new Personality(List.of("analytical", "logical")))
                .build();

        Explanation explanation = generator.explain(softwareEngineer, request);

        // 0.75*0.40 + 0.75*0.35 + (2/3)*0.15 + (2/3)*0.10 = 0.729
        assertThat(explanation.overallMatch()).isEqualTo(73);
        assertThat(explanation.skillGaps()).containsExactly("problem_solving");
        assertThat(explanation.strengths())
                .containsExactly("technology", "computers", "innovation",
                        "programming", "logical_thinking", "mathematics");
        assertThat(explanation.reasons())
                .contains("Your interests in technology, computers, innovation align well with this career")
                .contains("Strong interest alignment - you share most key interests for this field")
                .contains("You already have 3 out of 4 key skills: programming, logical_thinking, mathematics")
                .contains("Skills to develop: problem_solving")
                .contains("Excellent skill match - you have most required skills")
                .contains("Strong academic preparation for this field")
                .contains("Strong personality-career alignment");
    }

    @Test
    void explain_emptyRequest_reportsEveryGap() {
        Explanation explanation = generator.explain(softwareEngineer, RecommendationRequest.builder().build());

        assertThat(explanation.overallMatch()).isZero();
        assertThat(explanation.strengths()).isEmpty();
        assertThat(explanation.skillGaps()).containsExactlyElementsOf(softwareEngineer.requiredSkills());
        assertThat(explanation.reasons())
                .contains("Limited interest overlap - explore the field before committing")
                .contains("Significant skill development opportunity")
                .contains("Little related coursework so far - consider a foundation course");
    }

    @Test
    void explain_careerWithoutSubjects_usesNeutralSubjectScore() {
        Career noSubjects = softwareEngineer.toBuilder().subjects(List.of()).build();

        RecommendationRequest request = RecommendationRequest.builder()
                .skills(List.of("programming"))
                .build();

        Explanation explanation = generator.explain(noSubjects, request);

        // 0.25*0.35 + 0.5*0.15 = 0.1625
        assertThat(explanation.overallMatch()).isEqualTo(16);
        assertThat(explanation.reasons()).contains("Some relevant academic background");
    }

    @Test
    void explain_partialMatch_usesMiddleTier() {
        RecommendationRequest request = RecommendationRequest.builder()
                .interests(List.of("technology", "computers"))
                .skills(List.of("programming", "mathematics"))
                .build();

        Explanation explanation = generator.explain(softwareEngineer, request);

        assertThat(explanation.reasons())
                .contains("Good interest match - several of your interests align with this career")
                .contains("Good skill foundation - some development needed");
        assertThat(explanation.skillGaps()).containsExactly("problem_solving", "logical_thinking");
    }

    @Test
    void explain_careerWithoutInterests_readsAsStrongInterestAlignment() {
        Career noInterests = softwareEngineer.toBuilder().interests(List.of()).build();
        RecommendationRequest request = RecommendationRequest.builder()
                .interests(List.of("technology"))
                .build();

        Explanation explanation = generator.explain(noInterests, request);

        assertThat(explanation.reasons())
                .contains("Strong interest alignment - you share most key interests for this field")
                .doesNotContain("Limited interest overlap - explore the field before committing");
        assertThat(explanation.strengths()).isEmpty();
    }
}
