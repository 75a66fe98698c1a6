package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record CareerTip(
        int id,
        String title,
        String tip,
        String category,
        List<String> careerFocus) {

    public static final String ALL_CAREERS = "All careers";

    public CareerTip {
        careerFocus = Frozen.list(careerFocus);
    }

    public boolean appliesTo(String career) {
        return careerFocus.contains(career) || careerFocus.contains(ALL_CAREERS);
    }
}
