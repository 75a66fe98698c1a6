package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

/**
 * Descriptor of a four-letter personality type code.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersonalityArchetype(
        String name,
        List<String> traits,
        List<String> careers,
        String description) {

    public static final PersonalityArchetype UNIQUE = new PersonalityArchetype(
            "Unique Type",
            List.of("unique", "individual"),
            List.of("Various careers"),
            "A unique personality combination");

    public PersonalityArchetype {
        traits = Frozen.list(traits);
        careers = Frozen.list(careers);
    }
}
