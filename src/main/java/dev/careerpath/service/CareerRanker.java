package dev.careerpath.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.careerpath.model.Career;
import dev.careerpath.model.UserProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders careers by match score and builds the small graph shown next to the recommendations.
 */
@Service
@RequiredArgsConstructor
public class CareerRanker {

    static final String USER_NODE_ID = "user";
    static final int USER_NODE_SIZE = 20;
    static final int CAREER_NODE_SIZE = 15;

    private final MatchScorer matchScorer;

    public record RankedCareer(Career career, double score) {
    }

    public record Visualization(List<Node> nodes, List<Link> links) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Node(
            String id,
            String name,
            String type,
            int size,
            String salary,
            String growth,
            String region) {
    }

    public record Link(String source, String target, double strength) {
    }

    /**
     * Top {@code limit} careers, best score first. Equal scores keep their input order.
     */
    public List<RankedCareer> recommend(UserProfile profile, List<Career> careers, int limit) {
        List<RankedCareer> ranked = new ArrayList<>(careers.size());
        for (Career career : careers) {
            ranked.add(new RankedCareer(career, matchScorer.score(profile, career)));
        }
        // List.sort is stable
        ranked.sort(Comparator.comparingDouble(RankedCareer::score).reversed());
        return List.copyOf(ranked.subList(0, Math.min(Math.max(limit, 0), ranked.size())));
    }

    /**
     * One user node plus a node and a score-weighted link per career, for the first {@code size}
     * recommendations.
     */
    public Visualization visualize(UserProfile profile, List<RankedCareer> recommendations, int size) {
        List<Node> nodes = new ArrayList<>();
        List<Link> links = new ArrayList<>();

        nodes.add(new Node(USER_NODE_ID, "You (" + titleCase(profile.mode()) + ")", "user",
                USER_NODE_SIZE, null, null, profile.region()));

        for (int i = 0; i < Math.min(size, recommendations.size()); i++) {
            RankedCareer ranked = recommendations.get(i);
            Career career = ranked.career();
            String id = "career_" + i;
            nodes.add(new Node(id, career.name(), "career", CAREER_NODE_SIZE,
                    career.salaryFor(profile.region()), career.growthRate(), profile.region()));
            links.add(new Link(USER_NODE_ID, id, ranked.score()));
        }
        return new Visualization(List.copyOf(nodes), List.copyOf(links));
    }

    private static String titleCase(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase();
    }
}
