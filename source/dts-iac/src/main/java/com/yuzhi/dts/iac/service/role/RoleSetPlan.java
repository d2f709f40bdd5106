package com.yuzhi.dts.iac.service.role;

import com.yuzhi.dts.iac.domain.DiffItem;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class RoleSetPlan {

    private final Map<RoleSetStage, List<DiffItem>> stages = new EnumMap<>(RoleSetStage.class);

    public RoleSetPlan() {
        for (RoleSetStage stage : RoleSetStage.values()) {
            stages.put(stage, new ArrayList<>());
        }
    }

    void add(RoleSetStage stage, DiffItem item) {
        stages.get(stage).add(item);
    }

    public List<DiffItem> stage(RoleSetStage stage) {
        return List.copyOf(stages.get(stage));
    }

    /** Every item, in apply order. */
    public List<DiffItem> items() {
        List<DiffItem> all = new ArrayList<>();
        stages.values().forEach(all::addAll);
        return all;
    }

    public boolean isEmpty() {
        return stages.values().stream().allMatch(List::isEmpty);
    }
}
