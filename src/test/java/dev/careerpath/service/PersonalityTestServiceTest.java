package dev.careerpath.service;

import dev.careerpath.data.InMemoryReferenceDataStore;
import dev.careerpath.exception.ValidationException;
import dev.careerpath.model.PersonalityArchetype;
import dev.careerpath.service.PersonalityTestService.PersonalityResult;
import dev.careerpath.service.PersonalityTestService.Pole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersonalityTestServiceTest {

    private PersonalityTestService service;

    @BeforeEach
    void setUp() {
        PersonalityArchetype mediator = new PersonalityArchetype("The Mediator",
                List.of("idealistic", "empathetic"), List.of("Writer", "Counselor"), "Poetic and kind");
        service = new PersonalityTestService(InMemoryReferenceDataStore.builder()
                .personalityTypes(Map.of("INFP", mediator))
                .build());
    }

    private static List<Integer> answers(int value) {
        return new ArrayList<>(Collections.nCopies(12, value));
    }

    @Test
    void getQuestions_returnsTwelveNumberedQuestions() {
        assertThat(service.getQuestions()).hasSize(12);
        assertThat(service.getQuestions().get(0).id()).isEqualTo(1);
        assertThat(service.getQuestions().get(11).dimension()).isEqualTo(Pole.PERCEIVING);
    }

    @Test
    void calculate_neutralAnswers_tieToSecondLetters() {
        PersonalityResult result = service.calculate(answers(3));

        assertThat(result.type()).isEqualTo("INFP");
        assertThat(result.name()).isEqualTo("The Mediator");
        assertThat(result.suggestedCareers()).containsExactly("Writer", "Counselor");
        assertThat(result.scores()).containsEntry("extraversion", 9).containsEntry("introversion", 9);
    }

    @Test
    void calculate_stronglyAgree_favoursKeyedPoles() {
        PersonalityResult result = service.calculate(answers(5));

        assertThat(result.type()).isEqualTo("ESTJ");
        assertThat(result.scores())
                .containsEntry("extraversion", 15)
                .containsEntry("introversion", 3)
                .containsEntry("sensing", 10)
                .containsEntry("intuition", 2)
                .containsEntry("judging", 10)
                .containsEntry("perceiving", 2);
    }

    @Test
    void calculate_secondLetterQuestionsAreNotScored() {
        List<Integer> answers = answers(3);
        answers.set(11, 1);

        PersonalityResult result = service.calculate(answers);

        assertThat(result.type()).isEqualTo("INFP");
        assertThat(result.scores()).containsEntry("judging", 6).containsEntry("perceiving", 6);
    }

    @Test
    void calculate_stronglyDisagree_favoursOppositePoles() {
        assertThat(service.calculate(answers(1)).type()).isEqualTo("INFP");
    }

    @Test
    void calculate_unknownType_usesUniqueArchetype() {
        PersonalityResult result = service.calculate(answers(5));

        assertThat(result.name()).isEqualTo("Unique Type");
        assertThat(result.traits()).containsExactly("unique", "individual");
    }

    @Test
    void calculate_wrongAnswerCount_isRejected() {
        assertThatThrownBy(() -> service.calculate(List.of(3, 3, 3)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Exactly 12 answers");
        assertThatThrownBy(() -> service.calculate(null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void calculate_answerOutOfRange_isRejected() {
        List<Integer> answers = answers(3);
        answers.set(4, 6);

        assertThatThrownBy(() -> service.calculate(answers))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Answer 5 must be between 1 and 5 but was 6");
    }

    @Test
    void pole_oppositeIsSymmetric() {
        for (Pole pole : Pole.values()) {
            assertThat(pole.opposite().opposite()).isEqualTo(pole);
            assertThat(pole.opposite()).isNotEqualTo(pole);
        }
        assertThat(Pole.JUDGING.opposite()).isEqualTo(Pole.PERCEIVING);
        assertThat(Pole.SENSING.isFirstLetter()).isTrue();
        assertThat(Pole.FEELING.isFirstLetter()).isFalse();
    }
}
