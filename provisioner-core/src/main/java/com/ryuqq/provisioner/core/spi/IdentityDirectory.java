package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.result.CallResult;

/**
 * Transport SPI for the external identity directory.
 *
 * <p>Same result conventions as {@link WorkflowEngine}: a missing principal is {@code NotFound},
 * credential problems are {@code Unauthenticated}, everything else is {@code ServiceError}.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface IdentityDirectory {

    /**
     * Looks up a user by object id or user principal name.
     *
     * @param idOrPrincipalName object id or UPN
     * @return the directory entry
     */
    CallResult<DirectoryEntry> findUser(String idOrPrincipalName);

    /**
     * Looks up a group by object id.
     *
     * @param objectId group object id
     * @return the directory entry
     */
    CallResult<DirectoryEntry> findGroup(String objectId);
}
