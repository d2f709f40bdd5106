package com.yuzhi.dts.iac.service.access;

import com.yuzhi.dts.iac.domain.DesiredAccessEntry;
import java.util.List;

/**
 * Planned work for one folder. {@code containerId} is null when the folder will be created; {@code parentId} is null
 * when the parent itself is created earlier in the same pass and is looked up by name at apply time.
 */
public record FolderPlan(
    String name,
    String parentName,
    String parentId,
    String containerId,
    boolean inherits,
    List<AccessChange> changes,
    List<DesiredAccessEntry> desired
) {
    public FolderPlan {
        changes = changes == null ? List.of() : List.copyOf(changes);
        desired = desired == null ? List.of() : List.copyOf(desired);
    }

    public boolean isCreate() {
        return containerId == null;
    }

    public boolean hasWork() {
        return isCreate() || !changes.isEmpty();
    }
}
