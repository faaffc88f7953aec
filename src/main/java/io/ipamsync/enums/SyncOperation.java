package io.ipamsync.enums;

/**
 * Mutations the reconcilers issue against target platforms.
 */
public enum SyncOperation {
    CREATE_ADDRESS,
    DELETE_ADDRESS,
    CREATE_GROUP,
    UPDATE_GROUP,
    CREATE_SECURITY_GROUP,
    UPDATE_SECURITY_GROUP
}
