package uk.gegc.creditledger.features.workspace.domain.exception;

import uk.gegc.creditledger.shared.exception.ResourceNotFoundException;

import java.util.UUID;

public class WorkspaceNotFoundException extends ResourceNotFoundException {
    public WorkspaceNotFoundException(UUID workspaceId) {
        super("Workspace " + workspaceId + " not found");
    }
}
