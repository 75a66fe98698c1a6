package dev.careerpath.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillsGapRequest(
        String careerName,
        String region,
        List<String> userSkills,
        List<String> userSubjects,
        List<String> userInterests) {

    public SkillsGapRequest {
        userSkills = Frozen.list(userSkills);
        userSubjects = Frozen.list(userSubjects);
        userInterests = Frozen.list(userInterests);
    }
}
