package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkingHours(
        String start,
        String end,
        double totalHours,
        boolean flexible) {
}
