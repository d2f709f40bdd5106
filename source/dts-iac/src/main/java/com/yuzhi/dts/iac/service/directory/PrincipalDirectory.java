package com.yuzhi.dts.iac.service.directory;

import com.yuzhi.dts.iac.domain.AccessKey;
import com.yuzhi.dts.iac.domain.DesiredAccessEntry;
import com.yuzhi.dts.iac.domain.PrincipalType;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves principal names to backend ids. Lookups are cached for the lifetime of one instance, which is one run.
 */
public class PrincipalDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(PrincipalDirectory.class);

    /** Groups mirrored from the identity provider carry this suffix in the backend. */
    static final String MIRRORED_GROUP_SUFFIX = " (OIDC)";

    private final DirectoryClient client;
    private final Map<String, Optional<String>> groups = new HashMap<>();
    private final Map<String, Optional<String>> users = new HashMap<>();

    public PrincipalDirectory(DirectoryClient client) {
        this.client = client;
    }

    public Optional<AccessKey> resolve(DesiredAccessEntry entry) {
        Optional<String> id = entry.principalType() == PrincipalType.GROUP
            ? findGroupId(entry.principalName())
            : findUserId(entry.principalName());
        return id.map(value -> new AccessKey(entry.principalType(), value));
    }

    public Optional<String> findGroupId(String name) {
        return groups.computeIfAbsent(name, this::lookupGroup);
    }

    public Optional<String> findUserId(String email) {
        return users.computeIfAbsent(email, this::lookupUser);
    }

    private Optional<String> lookupGroup(String name) {
        try {
            Optional<String> exact = client.findGroupId(name);
            if (exact.isPresent()) {
                return exact;
            }
            return client.findGroupId(name + MIRRORED_GROUP_SUFFIX);
        } catch (DirectoryFetchException ex) {
            LOG.warn("Group lookup for '{}' failed: {}", name, ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> lookupUser(String email) {
        try {
            return client.findUserId(email);
        } catch (DirectoryFetchException ex) {
            LOG.warn("User lookup for '{}' failed: {}", email, ex.getMessage());
            return Optional.empty();
        }
    }
}
