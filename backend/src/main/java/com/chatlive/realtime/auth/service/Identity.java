package com.chatlive.realtime.auth.service;

public record Identity(String id, Role role, PermissionSet permissions) {

    public boolean has(Permission permission) {
        return permissions != null && permissions.has(permission);
    }

    public boolean atLeast(Role minimum) {
        return role != null && role.atLeast(minimum);
    }
}
