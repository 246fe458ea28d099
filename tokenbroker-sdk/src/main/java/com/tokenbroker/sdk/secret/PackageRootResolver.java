package com.tokenbroker.sdk.secret;

import java.nio.file.Path;

/**
 * Maps a package name to the directory its {@code secret/} folder lives in.
 */
@FunctionalInterface
public interface PackageRootResolver {

    Path rootOf(String packageName);

    /**
     * Each package gets its own subdirectory of {@code baseDirectory}.
     */
    static PackageRootResolver perPackage(Path baseDirectory) {
        return baseDirectory::resolve;
    }
}
