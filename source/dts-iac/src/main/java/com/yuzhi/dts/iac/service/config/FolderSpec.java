package com.yuzhi.dts.iac.service.config;

import com.yuzhi.dts.iac.domain.DesiredAccessEntry;
import java.util.List;

/**
 * Desired folder. A null parent means the root folder.
 */
public record FolderSpec(String name, String parent, List<DesiredAccessEntry> access) {
    public FolderSpec {
        access = access == null ? List.of() : List.copyOf(access);
    }
}
