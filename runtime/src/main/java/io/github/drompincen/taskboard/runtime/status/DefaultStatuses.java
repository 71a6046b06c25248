package io.github.drompincen.taskboard.runtime.status;

import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.Team;

import java.util.List;

/**
 * Vocabularies a fresh installation starts with.
 */
final class DefaultStatuses {

    private DefaultStatuses() {}

    static List<StatusDefinitionDto> forTeam(Team team) {
        switch (team) {
            case CREATIVE:
                return List.of(
                        new StatusDefinitionDto("not_started", team, "Not Started", "#94a3b8", 0),
                        new StatusDefinitionDto("scripting", team, "Scripting", "#a78bfa", 1),
                        new StatusDefinitionDto("script_confirmed", team, "Script Confirmed", "#8b5cf6", 2),
                        new StatusDefinitionDto("shoot_pending", team, "Shoot Pending", "#f97316", 3),
                        new StatusDefinitionDto("shoot_finished", team, "Shoot Finished", "#fb923c", 4),
                        new StatusDefinitionDto("edit_pending", team, "Edit Pending", "#3b82f6", 5),
                        new StatusDefinitionDto("client_approval", team, "Client Approval", "#ec4899", 6),
                        new StatusDefinitionDto("approved", team, "Approved", "#22c55e", 7));
            case WEB:
                return List.of(
                        new StatusDefinitionDto("proposal_awaiting", team, "Proposal Awaiting", "#94a3b8", 0),
                        new StatusDefinitionDto("not_started", team, "Not Started", "#6b7280", 1),
                        new StatusDefinitionDto("ui_started", team, "UI Started", "#a78bfa", 2),
                        new StatusDefinitionDto("ui_finished", team, "UI Finished", "#8b5cf6", 3),
                        new StatusDefinitionDto("development_started", team, "Development Started", "#3b82f6", 4),
                        new StatusDefinitionDto("development_finished", team, "Development Finished", "#2563eb", 5),
                        new StatusDefinitionDto("testing", team, "Testing", "#f97316", 6),
                        new StatusDefinitionDto("handed_over", team, "Handed Over", "#fb923c", 7),
                        new StatusDefinitionDto("client_reviewing", team, "Client Reviewing", "#ec4899", 8),
                        new StatusDefinitionDto("completed", team, "Completed", "#22c55e", 9));
            default:
                return List.of();
        }
    }
}
