package com.coursepath.dag;

import com.coursepath.prereq.AllOf;
import com.coursepath.prereq.RequirementExpression;

import java.util.Objects;

public record CourseNode(String id, RequirementExpression requirement) {
    public CourseNode {
        Objects.requireNonNull(id, "id");
        requirement = requirement == null ? AllOf.none() : requirement;
    }

    public boolean hasPrerequisites() {
        return !requirement.leaves().isEmpty();
    }
}
