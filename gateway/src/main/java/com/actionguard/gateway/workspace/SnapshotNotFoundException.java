package com.actionguard.gateway.workspace;

public class SnapshotNotFoundException extends SnapshotException {
    public SnapshotNotFoundException(String name) {
        super("Snapshot not found: '" + name + "'");
    }
}
