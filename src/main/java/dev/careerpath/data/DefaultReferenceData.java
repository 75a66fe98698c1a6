package dev.careerpath.data;

import dev.careerpath.model.Career;
import dev.careerpath.model.DimensionCriteria;
import dev.careerpath.model.LearningResource;
import dev.careerpath.model.PersonalityArchetype;
import dev.careerpath.model.RiskCriteria;
import dev.careerpath.model.SkillTaxonomy;
import dev.careerpath.model.WarningBand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal built-in tables served when a reference file is absent.
 */
public final class DefaultReferenceData {

    private DefaultReferenceData() {
    }

    public static List<Career> careers() {
        return List.of(Career.builder()
                .name("Software Engineer")
                .requiredSkills(List.of("programming", "problem_solving", "logical_thinking", "mathematics"))
                .interests(List.of("technology", "computers", "innovation", "problem_solving"))
                .subjects(List.of("computer_science", "mathematics", "physics"))
                .personalityTraits(List.of("analytical", "detail_oriented", "creative"))
                .description("Design and develop software applications and systems")
                .growthRate("22%")
                .medianSalary("$110,000")
                .jobOutlook("Much faster than average")
                .build());
    }

    public static SkillTaxonomy taxonomy() {
        Map<String, List<String>> subjects = new LinkedHashMap<>();
        subjects.put("computer_science", List.of("programming", "algorithms", "data_structures", "system_design"));
        subjects.put("mathematics", List.of("analytical_thinking", "problem_solving", "statistics", "logical_reasoning"));
        subjects.put("business", List.of("strategic_thinking", "communication", "leadership", "project_management"));
        subjects.put("psychology", List.of("empathy", "research", "communication", "analytical_thinking"));
        subjects.put("art", List.of("creativity", "design", "visual_thinking", "attention_to_detail"));

        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("technical", List.of("programming", "machine_learning", "data_analysis", "cybersecurity", "design"));
        categories.put("soft", List.of("communication", "leadership", "teamwork", "problem_solving", "creativity"));
        categories.put("business", List.of("project_management", "strategic_thinking", "marketing", "sales", "finance"));

        return SkillTaxonomy.builder()
                .subjectsToSkills(subjects)
                .skillCategories(categories)
                .learningResources(learningResources())
                .build();
    }

    public static Map<String, LearningResource> learningResources() {
        Map<String, LearningResource> resources = new LinkedHashMap<>();
        resources.put("programming", new LearningResource(
                List.of("Codecademy Python", "freeCodeCamp", "Python.org Tutorial"),
                List.of("LeetCode", "HackerRank", "Real Python"),
                List.of("System Design Interview", "Clean Code Book", "Design Patterns"),
                "3-6 months"));
        resources.put("machine_learning", new LearningResource(
                List.of("Andrew Ng Coursera", "Kaggle Learn", "Scikit-learn Tutorial"),
                List.of("Fast.ai", "Deep Learning Specialization", "Hands-On ML Book"),
                List.of("Papers with Code", "Google AI Research", "Advanced ML Courses"),
                "6-12 months"));
        resources.put("data_analysis", new LearningResource(
                List.of("Excel Basics", "SQL Tutorial", "Tableau Public"),
                List.of("Python Pandas", "R Programming", "Power BI"),
                List.of("Advanced Statistics", "A/B Testing", "Data Science Bootcamp"),
                "2-4 months"));
        resources.put("leadership", new LearningResource(
                List.of("Leadership Books", "Team Management Basics", "Communication Skills"),
                List.of("MBA Leadership Courses", "Conflict Resolution", "Strategic Thinking"),
                List.of("Executive Leadership Programs", "Change Management", "Organizational Psychology"),
                "1-2 years"));
        resources.put("design", new LearningResource(
                List.of("Figma Basics", "Design Principles", "Color Theory"),
                List.of("UX Design Course", "Prototyping", "User Research"),
                List.of("Design Systems", "Advanced Prototyping", "Design Leadership"),
                "3-6 months"));
        resources.put("cybersecurity", new LearningResource(
                List.of("CompTIA Security+", "Cybersecurity Basics", "Network Fundamentals"),
                List.of("Ethical Hacking", "CISSP Prep", "Incident Response"),
                List.of("Advanced Penetration Testing", "Security Architecture", "Threat Intelligence"),
                "6-12 months"));
        resources.put("communication", new LearningResource(
                List.of("Public Speaking Basics", "Writing Skills", "Active Listening"),
                List.of("Presentation Skills", "Technical Writing", "Cross-cultural Communication"),
                List.of("Executive Communication", "Negotiation Skills", "Crisis Communication"),
                "2-6 months"));
        resources.put("project_management", new LearningResource(
                List.of("Project Management Basics", "Agile Fundamentals", "Time Management"),
                List.of("PMP Certification", "Scrum Master", "Risk Management"),
                List.of("Program Management", "Portfolio Management", "Organizational Change"),
                "3-6 months"));
        return resources;
    }

    public static Map<String, PersonalityArchetype> personalityTypes() {
        Map<String, PersonalityArchetype> types = new LinkedHashMap<>();
        types.put("INTJ", new PersonalityArchetype("The Architect",
                List.of("analytical", "strategic", "independent"),
                List.of("Software Engineer", "Data Scientist", "Research Scientist"),
                "Strategic thinkers who love complex problems"));
        types.put("ENFP", new PersonalityArchetype("The Campaigner",
                List.of("creative", "enthusiastic", "collaborative"),
                List.of("UX Designer", "Marketing Manager", "Teacher"),
                "Creative and enthusiastic people-focused individuals"));
        types.put("ISTJ", new PersonalityArchetype("The Logistician",
                List.of("detail_oriented", "organized", "reliable"),
                List.of("Accountant", "Project Manager", "Engineer"),
                "Practical and fact-minded, reliable individuals"));
        types.put("ESTP", new PersonalityArchetype("The Entrepreneur",
                List.of("outgoing", "adaptable", "practical"),
                List.of("Sales Manager", "Marketing Manager", "Consultant"),
                "Energetic and adaptable, great at improvising"));
        return types;
    }

    /**
     * Bands [0, 0.3], [0.3, 0.6], [0.6, 1.0] for every dimension, with no career table
     * and no intervention strategies.
     */
    public static RiskCriteria riskCriteria() {
        Map<String, WarningBand> bands = new LinkedHashMap<>();
        bands.put("low_risk", WarningBand.of(0.0, 0.3,
                List.of("Keep up your current habits", "Review your progress each term")));
        bands.put("moderate_risk", WarningBand.of(0.3, 0.6,
                List.of("Talk to a mentor about the areas flagged", "Set short, measurable goals")));
        bands.put("high_risk", WarningBand.of(0.6, 1.0,
                List.of("Seek support from a counsellor", "Reassess your plan before committing further")));
        DimensionCriteria criteria = new DimensionCriteria(bands);

        Map<String, DimensionCriteria> dimensions = new LinkedHashMap<>();
        dimensions.put(RiskCriteria.ACADEMIC_CONSISTENCY, criteria);
        dimensions.put(RiskCriteria.INTEREST_STABILITY, criteria);
        dimensions.put(RiskCriteria.STRESS_TOLERANCE, criteria);
        return RiskCriteria.builder()
                .failureWarningCriteria(dimensions)
                .build();
    }
}
