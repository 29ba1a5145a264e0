package com.example.shiftplanner.plan;

import java.util.List;

/**
 * @param assignmentIds subset to confirm; {@code null} means every proposed assignment of the plan
 */
public record CommitRequest(List<String> assignmentIds, String userId) {
}
