package com.yuzhi.dts.iac.service.diff;

import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.domain.DiffAction;
import com.yuzhi.dts.iac.domain.DiffItem;
import com.yuzhi.dts.iac.domain.FieldChange;
import com.yuzhi.dts.iac.domain.FieldType;
import com.yuzhi.dts.iac.domain.LiveResource;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.domain.SecretRef;
import com.yuzhi.dts.iac.service.secret.MissingSecretException;
import com.yuzhi.dts.iac.service.secret.SecretResolver;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generic desired-versus-live comparison. Never emits deletes: removing an entry from desired config does not destroy
 * an untracked live resource.
 */
@Component
public class ResourceDiffer {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceDiffer.class);

    private final SecretResolver secretResolver;

    public ResourceDiffer(SecretResolver secretResolver) {
        this.secretResolver = secretResolver;
    }

    public List<DiffItem> diff(ResourceKind kind, List<DesiredResource> desired, List<LiveResource> live) {
        Map<String, LiveResource> liveByName = new LinkedHashMap<>();
        for (LiveResource resource : live) {
            liveByName.putIfAbsent(resource.name(), resource);
        }
        List<DiffItem> items = new ArrayList<>();
        for (DesiredResource resource : desired) {
            LiveResource existing = liveByName.get(resource.name());
            if (existing == null) {
                items.add(resolveSecrets(DiffItem.create(kind, resource.name(), resource.fields(), List.of()), resource));
                continue;
            }
            List<FieldChange> changes = compare(kind, resource, existing);
            if (!changes.isEmpty()) {
                items.add(update(kind, resource, existing.id(), changes));
            }
        }
        return items;
    }

    /**
     * Field changes for the declared comparable fields present in desired, in desired order.
     */
    public List<FieldChange> compare(ResourceKind kind, DesiredResource desired, LiveResource live) {
        ResourceSchema schema = ResourceSchemas.forKind(kind);
        List<FieldChange> changes = new ArrayList<>();
        desired
            .fields()
            .forEach((field, value) -> {
                FieldType type = schema.typeOf(field);
                if (type == null) {
                    return;
                }
                Object current = live.field(field);
                if (!FieldComparator.equivalent(type, current, value)) {
                    changes.add(new FieldChange(field, FieldComparator.display(type, current), FieldComparator.display(type, value)));
                }
            });
        return changes;
    }

    /**
     * Update item for changes computed elsewhere, with the full resolved payload of {@code desired}.
     */
    public DiffItem update(ResourceKind kind, DesiredResource desired, String id, List<FieldChange> changes) {
        return resolveSecrets(DiffItem.update(kind, desired.name(), id, changes, desired.fields()), desired);
    }

    private DiffItem resolveSecrets(DiffItem item, DesiredResource resource) {
        if (resource.secrets().isEmpty()) {
            return item;
        }
        Map<String, Object> payload = new LinkedHashMap<>(item.getPayload());
        List<String> unresolved = new ArrayList<>();
        for (Map.Entry<String, SecretRef> secret : resource.secrets().entrySet()) {
            try {
                payload.put(secret.getKey(), secretResolver.resolve(secret.getValue()));
            } catch (MissingSecretException ex) {
                LOG.warn(
                    "{} '{}': {}; field '{}' left out of the payload",
                    item.getKind().getDisplayName(),
                    item.getName(),
                    ex.getMessage(),
                    secret.getKey()
                );
                unresolved.add(secret.getKey());
            }
        }
        DiffItem resolved = item.getAction() == DiffAction.CREATE
            ? DiffItem.create(item.getKind(), item.getName(), payload, item.getChanges())
            : DiffItem.update(item.getKind(), item.getName(), item.getId(), item.getChanges(), payload);
        return unresolved.isEmpty() ? resolved : resolved.withUnresolvedSecrets(unresolved);
    }
}
