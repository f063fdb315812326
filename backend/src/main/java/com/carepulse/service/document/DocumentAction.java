package com.carepulse.service.document;

/**
 * Operations checked by {@link DocumentAccessPolicy}.
 */
public enum DocumentAction {
    VIEW,
    DOWNLOAD,
    UPDATE,
    DELETE,
    SHARE
}
