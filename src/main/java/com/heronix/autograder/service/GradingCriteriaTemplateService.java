package com.heronix.autograder.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.heronix.autograder.model.domain.AssignmentRecord;

import lombok.RequiredArgsConstructor;

/**
 * Example rubric shown next to the grading criteria editor, scaled to the
 * assignment's total points.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
public class GradingCriteriaTemplateService {

    private static final List<String> BEST_PRACTICES = List.of(
            "Use clear point breakdowns for each category",
            "Define specific requirements for each score level",
            "Include examples of what constitutes quality work",
            "Consider partial credit scenarios");

    private final RecordLookupService lookupService;

    public record GradingCriteriaTemplate(
            String assignmentId,
            int totalPoints,
            String exampleCriteria,
            List<String> bestPractices
    ) {}

    public GradingCriteriaTemplate templateFor(String assignmentId) {
        AssignmentRecord assignment = lookupService.getAssignment(assignmentId);
        int points = assignment.getPoints() != null ? assignment.getPoints() : 0;
        return new GradingCriteriaTemplate(assignmentId, points, exampleCriteria(points), BEST_PRACTICES);
    }

    /**
     * Content 40%, organization 30%, evidence the remainder, so the categories
     * always add up to {@code totalPoints}.
     */
    static String exampleCriteria(int totalPoints) {
        int content = Math.round(totalPoints * 0.4f);
        int organization = Math.round(totalPoints * 0.3f);
        int evidence = totalPoints - content - organization;

        return "Rubric Guidelines (Total: " + totalPoints + " points)\n"
                + "\n"
                + "Content Understanding [40%] (" + content + "pts)\n"
                + "• Complete (" + content + "pts): Demonstrates thorough understanding, accurate analysis\n"
                + "• Partial (" + range(content / 2, content - 1) + "pts): Shows basic comprehension, some gaps present\n"
                + "• Limited (" + range(0, Math.max(0, content / 2 - 1)) + "pts): Major misconceptions or incomplete response\n"
                + "\n"
                + "Organization [30%] (" + organization + "pts)\n"
                + "• Strong (" + organization + "pts): Clear structure, logical flow, well-connected ideas\n"
                + "• Developing (" + range(organization / 2, organization - 1) + "pts): Basic organization, some unclear transitions\n"
                + "• Needs Work (" + range(0, Math.max(0, organization / 2 - 1)) + "pts): Unclear structure, difficult to follow\n"
                + "\n"
                + "Evidence/Support [30%] (" + evidence + "pts)\n"
                + "• Thorough (" + evidence + "pts): Strong examples, relevant details\n"
                + "• Basic (" + range(evidence / 2, evidence - 1) + "pts): Some supporting evidence, needs development\n"
                + "• Limited (" + range(0, Math.max(0, evidence / 2 - 1)) + "pts): Lacks sufficient support\n"
                + "\n"
                + "Tips:\n"
                + "- Break total points into clear categories\n"
                + "- Define specific criteria per level\n"
                + "- Allow for partial credit\n"
                + "- Include concrete examples";
    }

    private static String range(int low, int high) {
        if (high <= low) {
            return String.valueOf(Math.max(low, 0));
        }
        return low + "-" + high;
    }
}
