package com.yuzhi.dts.iac.domain;

/**
 * A hierarchical container (folder) that owns an access list and may inherit it from its parent.
 */
public record ContainerInfo(String id, String name, String parentId, boolean inherits) {}
