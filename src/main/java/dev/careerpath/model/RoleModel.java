package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RoleModel(
        String name,
        String career,
        String title,
        List<String> keySkills,
        String inspirationQuote,
        String advice,
        List<String> achievements,
        List<String> careerPath,
        @JsonAlias("indian_context") String regionalContext) {

    public RoleModel {
        keySkills = Frozen.list(keySkills);
        achievements = Frozen.list(achievements);
        careerPath = Frozen.list(careerPath);
    }
}
