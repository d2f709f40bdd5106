package com.yuzhi.dts.iac.service.access;

import com.yuzhi.dts.iac.domain.AccessKey;

/**
 * One planned mutation of a container access list. {@code entryId} is the live entry for updates and removals.
 */
public record AccessChange(Type type, AccessKey key, String principalName, String entryId, String before, String after) {
    public enum Type {
        BREAK_INHERITANCE,
        ADD,
        UPDATE,
        REMOVE
    }

    public static AccessChange breakInheritance() {
        return new AccessChange(Type.BREAK_INHERITANCE, null, null, null, null, null);
    }

    public static AccessChange add(AccessKey key, String principalName, String permission) {
        return new AccessChange(Type.ADD, key, principalName, null, null, permission);
    }

    public static AccessChange update(AccessKey key, String principalName, String entryId, String before, String after) {
        return new AccessChange(Type.UPDATE, key, principalName, entryId, before, after);
    }

    public static AccessChange remove(AccessKey key, String entryId, String before) {
        return new AccessChange(Type.REMOVE, key, null, entryId, before, null);
    }

    public String describe() {
        String who = principalName == null ? String.valueOf(key) : key.principalType().label() + " '" + principalName + "'";
        return switch (type) {
            case BREAK_INHERITANCE -> "break inheritance";
            case ADD -> "add " + who + " (" + after + ")";
            case UPDATE -> "update " + who + " (" + before + " -> " + after + ")";
            case REMOVE -> "remove " + who + " (" + before + ")";
        };
    }
}
