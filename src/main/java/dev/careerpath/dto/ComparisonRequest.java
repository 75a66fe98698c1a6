package dev.careerpath.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ComparisonRequest(List<String> careers, String region) {

    public ComparisonRequest {
        careers = Frozen.list(careers);
    }
}
