package com.ryuqq.provisioner.core.spi;

/**
 * Raw directory lookup response.
 *
 * @param id object id
 * @param displayName display name
 * @param userPrincipalName UPN (users only, nullable)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record DirectoryEntry(String id, String displayName, String userPrincipalName) {

    public DirectoryEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (displayName == null) {
            displayName = id;
        }
    }
}
