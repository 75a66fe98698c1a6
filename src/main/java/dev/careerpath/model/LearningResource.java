package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record LearningResource(
        List<String> beginner,
        List<String> intermediate,
        List<String> advanced,
        String timeEstimate) {

    public LearningResource {
        beginner = Frozen.list(beginner);
        intermediate = Frozen.list(intermediate);
        advanced = Frozen.list(advanced);
    }
}
