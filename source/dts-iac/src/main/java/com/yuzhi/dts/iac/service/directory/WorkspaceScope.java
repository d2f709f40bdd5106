package com.yuzhi.dts.iac.service.directory;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Switches the backend session into a workspace for the duration of a try-with-resources block and restores the
 * previous workspace on close, whether the block completed or threw. When the session does not report its current
 * workspace, the fallback workspace is restored instead.
 */
public final class WorkspaceScope implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(WorkspaceScope.class);

    private final DirectoryClient client;
    private final String previous;
    private final String active;
    private boolean closed;

    private WorkspaceScope(DirectoryClient client, String previous, String active) {
        this.client = client;
        this.previous = previous;
        this.active = active;
    }

    public static WorkspaceScope enter(DirectoryClient client, String workspaceId, String fallback) {
        String previous = client.currentWorkspace();
        if (previous == null) {
            LOG.debug("Session reports no workspace, {} will be restored", fallback);
            previous = fallback;
        }
        if (!Objects.equals(previous, workspaceId)) {
            client.switchWorkspace(workspaceId);
            LOG.debug("Switched workspace {} -> {}", previous, workspaceId);
        }
        return new WorkspaceScope(client, previous, workspaceId);
    }

    public String getActive() {
        return active;
    }

    public String getPrevious() {
        return previous;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (Objects.equals(previous, active)) {
            return;
        }
        client.switchWorkspace(previous);
        LOG.debug("Restored workspace {} -> {}", active, previous);
    }
}
