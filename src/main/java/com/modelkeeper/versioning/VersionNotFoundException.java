package com.modelkeeper.versioning;

public class VersionNotFoundException extends StorageException {
    private final String versionId;

    public VersionNotFoundException(String versionId) {
        super("Backup version not found: " + versionId);
        this.versionId = versionId;
    }

    public String versionId() {
        return versionId;
    }
}
