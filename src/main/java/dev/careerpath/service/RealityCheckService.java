package dev.careerpath.service;

import dev.careerpath.data.ReferenceDataStore;
import dev.careerpath.exception.NotFoundException;
import dev.careerpath.model.RealityCheckEntry;
import dev.careerpath.model.RealityCheckTable;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Challenges, misconceptions and backup options for a career.
 */
@Service
@RequiredArgsConstructor
public class RealityCheckService {

    private final ReferenceDataStore referenceData;

    public record RealityCheckReport(
            String careerName,
            RealityCheckEntry realityCheck,
            Map<String, List<String>> generalInsights) {
    }

    public List<String> availableCareers() {
        return List.copyOf(referenceData.getRealityChecks().careerRealityData().keySet());
    }

    /**
     * Reality check of a career. The name is matched exactly first, then ignoring case.
     *
     * @throws NotFoundException listing the careers that do have a reality check
     */
    public RealityCheckReport realityCheck(String careerName) {
        RealityCheckTable table = referenceData.getRealityChecks();
        Map<String, RealityCheckEntry> entries = table.careerRealityData();

        String key = entries.containsKey(careerName)
                ? careerName
                : entries.keySet().stream()
                        .filter(name -> name.equalsIgnoreCase(careerName))
                        .findFirst()
                        .orElseThrow(() -> new NotFoundException(
                                "Career data not found for \"" + careerName + "\"", availableCareers()));

        return new RealityCheckReport(key, entries.get(key), table.generalInsights());
    }
}
