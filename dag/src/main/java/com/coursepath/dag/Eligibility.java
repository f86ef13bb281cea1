package com.coursepath.dag;

import com.coursepath.prereq.RequirementExpression;

import java.util.List;

/**
 * Why a course can or cannot be taken.
 *
 * @param unmet the parts of the requirement not yet satisfied: the failing conjuncts of an all-of, otherwise the
 *              whole requirement. Empty when the requirement is met.
 */
public record Eligibility(String courseId, boolean eligible, boolean alreadyCompleted, List<RequirementExpression> unmet) {
    public Eligibility {
        unmet = List.copyOf(unmet);
    }
}
