package com.example.shiftplanner.client;

import com.example.shiftplanner.assignment.AssignmentDto;

/**
 * A local edit the server has not confirmed yet. {@code changeId} names the most recent
 * save, so a confirmation of an older save leaves the entry in place.
 */
public record OverlayEntry(AssignmentDto assignment, ChangeOrigin origin, String changeId) {
}
