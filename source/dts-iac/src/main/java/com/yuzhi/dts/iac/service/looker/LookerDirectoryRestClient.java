package com.yuzhi.dts.iac.service.looker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yuzhi.dts.iac.config.IacProperties;
import com.yuzhi.dts.iac.domain.AccessEntry;
import com.yuzhi.dts.iac.domain.ContainerInfo;
import com.yuzhi.dts.iac.domain.LiveResource;
import com.yuzhi.dts.iac.domain.PrincipalType;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.service.config.DesiredResourceMapper;
import com.yuzhi.dts.iac.service.directory.DirectoryClient;
import com.yuzhi.dts.iac.service.directory.DirectoryFetchException;
import com.yuzhi.dts.iac.service.directory.DirectoryMutationException;
import com.yuzhi.dts.iac.service.role.RoleSetReconciler;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Directory backend over the BI platform REST API (version 4.0). Folders are addressed by folder id; their access
 * lists live on the folder's content metadata, whose id is looked up and cached per folder.
 */
@Service
@ConditionalOnProperty(prefix = "dts.iac.backend", name = "mode", havingValue = "rest", matchIfMissing = true)
public class LookerDirectoryRestClient implements DirectoryClient {

    private static final Logger LOG = LoggerFactory.getLogger(LookerDirectoryRestClient.class);
    private static final TypeReference<List<Map<String, Object>>> LIST_OF_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String API_PATH = "/api/4.0";
    private static final String OIDC_ID = "oidc";
    private static final int PREVIEW_LIMIT = 512;

    private static final Map<ResourceKind, String> ENDPOINTS = new EnumMap<>(ResourceKind.class);

    static {
        ENDPOINTS.put(ResourceKind.CONNECTION, "connections");
        ENDPOINTS.put(ResourceKind.PROJECT, "projects");
        ENDPOINTS.put(ResourceKind.LOOKML_MODEL, "lookml_models");
        ENDPOINTS.put(ResourceKind.PERMISSION_SET, "permission_sets");
        ENDPOINTS.put(ResourceKind.MODEL_SET, "model_sets");
        ENDPOINTS.put(ResourceKind.ROLE, "roles");
        ENDPOINTS.put(ResourceKind.FOLDER, "folders");
        ENDPOINTS.put(ResourceKind.OIDC_CONFIG, "oidc_config");
    }

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final LookerAuthService authService;
    private final String apiBase;
    private final Map<String, String> contentMetadataIds = new ConcurrentHashMap<>();

    public LookerDirectoryRestClient(
        IacProperties properties,
        LookerAuthService authService,
        RestTemplateBuilder restTemplateBuilder,
        ObjectMapper objectMapper
    ) {
        IacProperties.Backend backend = properties.getBackend();
        this.authService = authService;
        this.objectMapper = objectMapper;
        this.restTemplate = restTemplateBuilder
            .setConnectTimeout(backend.getConnectTimeout())
            .setReadTimeout(backend.getReadTimeout())
            .errorHandler(new NoOpErrorHandler())
            .build();
        this.apiBase = apiBase(backend.getBaseUrl());
        LOG.info("Directory API endpoint: {}", apiBase);
    }

    static String apiBase(String baseUrl) {
        if (StringUtils.isBlank(baseUrl)) {
            throw new IllegalArgumentException("dts.iac.backend.base-url must be set for the rest backend");
        }
        String trimmed = StringUtils.removeEnd(baseUrl.trim(), "/");
        return trimmed.endsWith(API_PATH) ? trimmed : trimmed + API_PATH;
    }

    // ---- Generic resources ----

    @Override
    public List<LiveResource> listAll(ResourceKind kind) {
        if (kind == ResourceKind.OIDC_CONFIG) {
            return get(kind, OIDC_ID).map(List::of).orElse(List.of());
        }
        List<LiveResource> resources = new ArrayList<>();
        for (Map<String, Object> item : fetchList(uri(Map.of(), ENDPOINTS.get(kind)), "list " + kind.getDisplayName())) {
            resources.add(toLive(kind, item));
        }
        return resources;
    }

    @Override
    public Optional<LiveResource> get(ResourceKind kind, String id) {
        URI uri = kind == ResourceKind.OIDC_CONFIG ? uri(Map.of(), ENDPOINTS.get(kind)) : uri(Map.of(), ENDPOINTS.get(kind), id);
        return fetchObject(uri, "read " + kind.getDisplayName() + " " + id).map(item -> toLive(kind, item));
    }

    @Override
    public String create(ResourceKind kind, Map<String, Object> payload) {
        if (kind == ResourceKind.OIDC_CONFIG) {
            throw new DirectoryMutationException("OIDC configuration is a singleton and cannot be created");
        }
        Map<String, Object> created = send(
            HttpMethod.POST,
            uri(Map.of(), ENDPOINTS.get(kind)),
            toWrite(kind, payload),
            "create " + kind.getDisplayName()
        );
        return idOf(kind, created);
    }

    @Override
    public void update(ResourceKind kind, String id, Map<String, Object> payload) {
        URI uri = kind == ResourceKind.OIDC_CONFIG ? uri(Map.of(), ENDPOINTS.get(kind)) : uri(Map.of(), ENDPOINTS.get(kind), id);
        send(HttpMethod.PATCH, uri, toWrite(kind, payload), "update " + kind.getDisplayName() + " " + id);
    }

    @Override
    public void delete(ResourceKind kind, String id) {
        if (kind == ResourceKind.OIDC_CONFIG || kind == ResourceKind.PROJECT) {
            throw new DirectoryMutationException(kind.getDisplayName() + " cannot be deleted through this tool");
        }
        send(HttpMethod.DELETE, uri(Map.of(), ENDPOINTS.get(kind), id), null, "delete " + kind.getDisplayName() + " " + id);
    }

    // ---- Containers ----

    @Override
    public Optional<ContainerInfo> getContainer(String containerId) {
        return fetchObject(uri(Map.of(), "folders", containerId), "read folder " + containerId).map(this::toContainer);
    }

    @Override
    public Optional<ContainerInfo> findChildContainer(String parentId, String name) {
        return fetchList(uri(Map.of(), "folders", parentId, "children"), "list children of folder " + parentId)
            .stream()
            .filter(folder -> Objects.equals(folder.get("name"), name))
            .findFirst()
            .map(this::toContainer);
    }

    @Override
    public Optional<ContainerInfo> searchContainer(String name) {
        return fetchList(uri(Map.of("name", name), "folders", "search"), "search folder " + name)
            .stream()
            .findFirst()
            .map(this::toContainer);
    }

    @Override
    public ContainerInfo createContainer(String name, String parentId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("parent_id", parentId);
        return toContainer(send(HttpMethod.POST, uri(Map.of(), "folders"), body, "create folder " + name));
    }

    @Override
    public List<AccessEntry> listAccessEntries(String containerId) {
        String metadataId = contentMetadataId(containerId, true);
        List<AccessEntry> entries = new ArrayList<>();
        for (Map<String, Object> item : fetchList(
            uri(Map.of("content_metadata_id", metadataId), "content_metadata_access"),
            "list access of folder " + containerId
        )) {
            String groupId = string(item.get("group_id"));
            PrincipalType type = groupId != null ? PrincipalType.GROUP : PrincipalType.USER;
            String principalId = groupId != null ? groupId : string(item.get("user_id"));
            entries.add(new AccessEntry(string(item.get("id")), containerId, type, principalId, string(item.get("permission_type"))));
        }
        return entries;
    }

    @Override
    public String addAccessEntry(String containerId, PrincipalType principalType, String principalId, String permission) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content_metadata_id", contentMetadataId(containerId, false));
        body.put("permission_type", permission);
        body.put(principalType == PrincipalType.GROUP ? "group_id" : "user_id", principalId);
        Map<String, Object> created = send(
            HttpMethod.POST,
            uri(Map.of(), "content_metadata_access"),
            body,
            "add access to folder " + containerId
        );
        return string(created.get("id"));
    }

    @Override
    public void updateAccessEntry(String entryId, String permission) {
        send(
            HttpMethod.PUT,
            uri(Map.of(), "content_metadata_access", entryId),
            Map.of("permission_type", permission),
            "update access " + entryId
        );
    }

    @Override
    public void removeAccessEntry(String entryId) {
        send(HttpMethod.DELETE, uri(Map.of(), "content_metadata_access", entryId), null, "remove access " + entryId);
    }

    @Override
    public void setInheritance(String containerId, boolean inherits) {
        String metadataId = contentMetadataId(containerId, false);
        send(
            HttpMethod.PATCH,
            uri(Map.of(), "content_metadata", metadataId),
            Map.of("inherits", inherits),
            "set inheritance of folder " + containerId
        );
    }

    // ---- Principals ----

    @Override
    public Optional<String> findGroupId(String name) {
        return fetchList(uri(Map.of("name", name), "groups", "search"), "search group " + name)
            .stream()
            .filter(group -> Objects.equals(group.get("name"), name))
            .findFirst()
            .map(group -> string(group.get("id")));
    }

    @Override
    public Optional<String> findUserId(String email) {
        return fetchList(uri(Map.of("email", email), "users", "search"), "search user " + email)
            .stream()
            .findFirst()
            .map(user -> string(user.get("id")));
    }

    // ---- Session ----

    @Override
    public String currentWorkspace() {
        return fetchObject(uri(Map.of(), "session"), "read session").map(session -> string(session.get("workspace_id"))).orElse(null);
    }

    @Override
    public void switchWorkspace(String workspaceId) {
        send(HttpMethod.PATCH, uri(Map.of(), "session"), Map.of("workspace_id", workspaceId), "switch workspace to " + workspaceId);
    }

    @Override
    public Set<String> listPermissionNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> item : fetchList(uri(Map.of(), "permissions"), "list permissions")) {
            String name = string(item.get("permission"));
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    // ---- Mapping ----

    private LiveResource toLive(ResourceKind kind, Map<String, Object> item) {
        Map<String, Object> fields = new LinkedHashMap<>(item);
        if (kind == ResourceKind.ROLE) {
            fields.put(RoleSetReconciler.PERMISSION_SET_ID_FIELD, nestedId(item.get("permission_set")));
            fields.put(RoleSetReconciler.MODEL_SET_ID_FIELD, nestedId(item.get("model_set")));
        }
        if (kind == ResourceKind.OIDC_CONFIG) {
            return new LiveResource(OIDC_ID, DesiredResourceMapper.OIDC_NAME, fields);
        }
        return new LiveResource(idOf(kind, item), string(item.get("name")), fields);
    }

    private Map<String, Object> toWrite(ResourceKind kind, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        payload.forEach((key, value) -> {
            if (value != null) {
                body.put(key, value);
            }
        });
        if (kind == ResourceKind.PROJECT && !body.containsKey("id")) {
            body.put("id", body.get("name"));
        }
        return body;
    }

    private static String idOf(ResourceKind kind, Map<String, Object> item) {
        // connections and models are addressed by name
        if (kind == ResourceKind.CONNECTION || kind == ResourceKind.LOOKML_MODEL) {
            return string(item.get("name"));
        }
        return string(item.get("id"));
    }

    private ContainerInfo toContainer(Map<String, Object> folder) {
        String id = string(folder.get("id"));
        String metadataId = string(folder.get("content_metadata_id"));
        boolean inherits = false;
        if (metadataId != null) {
            contentMetadataIds.put(id, metadataId);
            inherits = fetchObject(uri(Map.of(), "content_metadata", metadataId), "read content metadata " + metadataId)
                .map(meta -> Boolean.TRUE.equals(meta.get("inherits")))
                .orElse(false);
        }
        return new ContainerInfo(id, string(folder.get("name")), string(folder.get("parent_id")), inherits);
    }

    private String contentMetadataId(String containerId, boolean forRead) {
        String cached = contentMetadataIds.get(containerId);
        if (cached != null) {
            return cached;
        }
        Function<String, RuntimeException> failure = forRead ? DirectoryFetchException::new : DirectoryMutationException::new;
        Map<String, Object> folder = fetchObject(uri(Map.of(), "folders", containerId), "read folder " + containerId)
            .orElseThrow(() -> failure.apply("Folder not found: " + containerId));
        String metadataId = string(folder.get("content_metadata_id"));
        if (metadataId == null) {
            throw failure.apply("Folder " + containerId + " has no content metadata");
        }
        contentMetadataIds.put(containerId, metadataId);
        return metadataId;
    }

    private static Object nestedId(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return string(nested.get("id"));
        }
        return null;
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    // ---- HTTP ----

    private URI uri(Map<String, ?> query, String... segments) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(apiBase).pathSegment(segments);
        query.forEach((key, value) -> builder.queryParam(key, value));
        return builder.encode().build().toUri();
    }

    private List<Map<String, Object>> fetchList(URI uri, String action) {
        ResponseEntity<String> response = exchangeForRead(uri, action);
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new DirectoryFetchException(describeFailure(action, response));
        }
        try {
            String body = response.getBody();
            return StringUtils.isBlank(body) ? List.of() : objectMapper.readValue(body, LIST_OF_MAP);
        } catch (IOException ex) {
            throw new DirectoryFetchException("Cannot parse response to " + action + ": " + ex.getMessage(), ex);
        }
    }

    private Optional<Map<String, Object>> fetchObject(URI uri, String action) {
        ResponseEntity<String> response = exchangeForRead(uri, action);
        if (response.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return Optional.empty();
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new DirectoryFetchException(describeFailure(action, response));
        }
        try {
            String body = response.getBody();
            return StringUtils.isBlank(body) ? Optional.empty() : Optional.of(objectMapper.readValue(body, MAP_TYPE));
        } catch (IOException ex) {
            throw new DirectoryFetchException("Cannot parse response to " + action + ": " + ex.getMessage(), ex);
        }
    }

    private Map<String, Object> send(HttpMethod method, URI uri, Object payload, String action) {
        ResponseEntity<String> response;
        try {
            response = exchange(uri, method, payload);
        } catch (RestClientException | LookerAuthException ex) {
            throw new DirectoryMutationException("Failed to " + action + ": " + ex.getMessage(), ex);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new DirectoryMutationException(describeFailure(action, response));
        }
        String body = response.getBody();
        if (StringUtils.isBlank(body)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, MAP_TYPE);
        } catch (IOException ex) {
            LOG.debug("Response to {} is not a JSON object: {}", action, truncate(body));
            return Map.of();
        }
    }

    private ResponseEntity<String> exchangeForRead(URI uri, String action) {
        try {
            return exchange(uri, HttpMethod.GET, null);
        } catch (RestClientException | LookerAuthException ex) {
            throw new DirectoryFetchException("Failed to " + action + ": " + ex.getMessage(), ex);
        }
    }

    private ResponseEntity<String> exchange(URI uri, HttpMethod method, Object payload) {
        ResponseEntity<String> response = exchangeOnce(uri, method, payload);
        if (response.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
            // token revoked or expired early
            authService.invalidate();
            response = exchangeOnce(uri, method, payload);
        }
        return response;
    }

    private ResponseEntity<String> exchangeOnce(URI uri, HttpMethod method, Object payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(authService.accessToken());
        if (payload != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        HttpEntity<?> entity = payload == null ? new HttpEntity<>(headers) : new HttpEntity<>(payload, headers);
        if (LOG.isDebugEnabled()) {
            String bodyPreview;
            try {
                bodyPreview = payload == null ? "<none>" : objectMapper.writeValueAsString(redact(payload));
            } catch (IOException e) {
                bodyPreview = "<unserializable>";
            }
            LOG.debug("API REQ method={}, uri={}, payload={}", method, uri, truncate(bodyPreview));
        }
        ResponseEntity<String> response = restTemplate.exchange(uri, method, entity, String.class);
        int code = response.getStatusCode().value();
        if (code >= 400) {
            LOG.warn("API RESP status={} uri={} body={}", code, uri, truncate(response.getBody()));
        } else if (LOG.isDebugEnabled()) {
            LOG.debug("API RESP status={} uri={}", code, uri);
        }
        return response;
    }

    private static Object redact(Object payload) {
        if (!(payload instanceof Map<?, ?> map)) {
            return payload;
        }
        Map<Object, Object> copy = new LinkedHashMap<>(map);
        for (String secret : List.of("password", "certificate", "secret", "client_secret")) {
            if (copy.containsKey(secret)) {
                copy.put(secret, "******");
            }
        }
        return copy;
    }

    private static String describeFailure(String action, ResponseEntity<String> response) {
        String body = response.getBody();
        if (body != null && !body.isBlank()) {
            return "Failed to " + action + ": HTTP " + response.getStatusCode().value() + " " + truncate(body);
        }
        return "Failed to " + action + ": HTTP " + response.getStatusCode().value();
    }

    private static String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() <= PREVIEW_LIMIT ? value : value.substring(0, PREVIEW_LIMIT) + "...";
    }

    private static class NoOpErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {}
    }
}
