package org.mimir.report;

/**
 * A derived suggestion; recomputed on every request, never stored.
 *
 * @param projectedImprovement estimated fraction of requests that would get faster
 */
public record OptimizationRecommendation(
        RecommendationKind kind,
        Priority priority,
        String rationale,
        String expectedImpact,
        double projectedImprovement
) {
    public static OptimizationRecommendation of(RecommendationKind kind, double improvement,
                                                String rationale, String expectedImpact) {
        return new OptimizationRecommendation(kind, Priority.forImprovement(improvement), rationale, expectedImpact, improvement);
    }
}
