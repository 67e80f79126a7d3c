package com.actionguard.gateway.workspace;

import java.nio.file.Path;

/**
 * A stored snapshot directory.
 *
 * @param name  {@code {env}-{yyyyMMdd'T'HHmmss'Z'}}, optionally with a {@code -001}-style suffix
 * @param path  absolute location under the snapshot root
 */
public record SnapshotInfo(String name, Path path) {}
