package dev.careerpath.service;

import dev.careerpath.data.ReferenceDataStore;
import dev.careerpath.exception.ValidationException;
import dev.careerpath.model.PersonalityArchetype;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Twelve-question personality test producing a four-letter type code.
 * <p>
 * An answer to a question keyed to a first-letter pole (E, S, T, J) adds {@code answer * weight}
 * to that pole and {@code (6 - answer) * weight} to the opposite one. Questions keyed to a
 * second-letter pole are shown but not scored. A letter goes to the first pole of a pair only when
 * it scores strictly higher, so an all-neutral test yields {@code INFP}.
 */
@Service
@RequiredArgsConstructor
public class PersonalityTestService {

    public static final int QUESTION_COUNT = 12;
    public static final int MIN_ANSWER = 1;
    public static final int MAX_ANSWER = 5;

    private static final List<Question> QUESTIONS = List.of(
            new Question(1, "I prefer working in teams rather than alone", Pole.EXTRAVERSION, 1),
            new Question(2, "I enjoy meeting new people and making connections", Pole.EXTRAVERSION, 1),
            new Question(3, "I prefer concrete facts over abstract theories", Pole.SENSING, 1),
            new Question(4, "I focus on details rather than the big picture", Pole.SENSING, 1),
            new Question(5, "I make decisions based on logic rather than feelings", Pole.THINKING, 1),
            new Question(6, "I analyze problems objectively without emotional bias", Pole.THINKING, 1),
            new Question(7, "I prefer to plan ahead rather than be spontaneous", Pole.JUDGING, 1),
            new Question(8, "I like to have things organized and structured", Pole.JUDGING, 1),
            new Question(9, "I get energized by social interactions", Pole.EXTRAVERSION, 1),
            new Question(10, "I trust my intuition when making decisions", Pole.INTUITION, 1),
            new Question(11, "I consider how decisions affect people's feelings", Pole.FEELING, 1),
            new Question(12, "I adapt easily to changing situations", Pole.PERCEIVING, 1));

    private final ReferenceDataStore referenceData;

    /**
     * One side of a dichotomy. The four pairs are listed first-letter pole then second-letter pole.
     */
    public enum Pole {
        EXTRAVERSION("extraversion", 'E'),
        INTROVERSION("introversion", 'I'),
        SENSING("sensing", 'S'),
        INTUITION("intuition", 'N'),
        THINKING("thinking", 'T'),
        FEELING("feeling", 'F'),
        JUDGING("judging", 'J'),
        PERCEIVING("perceiving", 'P');

        private final String key;
        private final char letter;

        Pole(String key, char letter) {
            this.key = key;
            this.letter = letter;
        }

        public String getKey() {
            return key;
        }

        public char getLetter() {
            return letter;
        }

        public boolean isFirstLetter() {
            return ordinal() % 2 == 0;
        }

        public Pole opposite() {
            Pole[] poles = values();
            return poles[ordinal() ^ 1];
        }
    }

    public record Question(int id, String question, Pole dimension, int weight) {
    }

    public record PersonalityResult(
            String type,
            String name,
            List<String> traits,
            List<String> suggestedCareers,
            String description,
            Map<String, Integer> scores) {
    }

    public List<Question> getQuestions() {
        return QUESTIONS;
    }

    public PersonalityResult calculate(List<Integer> answers) {
        validate(answers);

        Map<Pole, Integer> scores = new LinkedHashMap<>();
        for (Pole pole : Pole.values()) {
            scores.put(pole, 0);
        }
        for (int i = 0; i < QUESTIONS.size(); i++) {
            Question question = QUESTIONS.get(i);
            if (!question.dimension().isFirstLetter()) {
                continue;
            }
            int answer = answers.get(i);
            scores.merge(question.dimension(), answer * question.weight(), Integer::sum);
            scores.merge(question.dimension().opposite(), (6 - answer) * question.weight(), Integer::sum);
        }

        StringBuilder code = new StringBuilder(4);
        Pole[] poles = Pole.values();
        for (int i = 0; i < poles.length; i += 2) {
            Pole first = poles[i];
            Pole second = poles[i + 1];
            code.append(scores.get(first) > scores.get(second) ? first.getLetter() : second.getLetter());
        }
        String type = code.toString();

        PersonalityArchetype archetype = referenceData.getPersonalityTypes()
                .getOrDefault(type, PersonalityArchetype.UNIQUE);

        Map<String, Integer> named = new LinkedHashMap<>();
        scores.forEach((pole, score) -> named.put(pole.getKey(), score));

        return new PersonalityResult(type, archetype.name(), archetype.traits(), archetype.careers(),
                archetype.description(), named);
    }

    private static void validate(List<Integer> answers) {
        if (answers == null || answers.size() != QUESTION_COUNT) {
            throw new ValidationException("Exactly " + QUESTION_COUNT + " answers are required but got "
                    + (answers == null ? 0 : answers.size()));
        }
        for (int i = 0; i < answers.size(); i++) {
            Integer answer = answers.get(i);
            if (answer == null || answer < MIN_ANSWER || answer > MAX_ANSWER) {
                throw new ValidationException("Answer " + (i + 1) + " must be between "
                        + MIN_ANSWER + " and " + MAX_ANSWER + " but was " + answer);
            }
        }
    }
}
