package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;

import java.util.List;

/**
 * Personality section of a request: the traits the user identifies with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Personality(List<String> traits) {

    public static final Personality NONE = new Personality(List.of());

    public Personality {
        traits = Frozen.list(traits);
    }
}
