package com.ryuqq.provisioner.testkit.fake;

import com.ryuqq.provisioner.core.result.CallResult;
import com.ryuqq.provisioner.core.spi.DirectoryEntry;
import com.ryuqq.provisioner.core.spi.IdentityDirectory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-process {@link IdentityDirectory} holding users and groups in memory.
 *
 * <p>Users are found by object id or user principal name. A test can force every lookup to
 * return a given result to simulate an outage or expired credentials.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class FakeIdentityDirectory implements IdentityDirectory {

    private final Map<String, DirectoryEntry> users = new ConcurrentHashMap<>();
    private final Map<String, DirectoryEntry> groups = new ConcurrentHashMap<>();
    private final AtomicInteger userLookups = new AtomicInteger();
    private final AtomicInteger groupLookups = new AtomicInteger();
    private volatile Supplier<CallResult<DirectoryEntry>> outage;

    public FakeIdentityDirectory addUser(String id, String displayName, String userPrincipalName) {
        DirectoryEntry entry = new DirectoryEntry(id, displayName, userPrincipalName);
        users.put(id, entry);
        if (userPrincipalName != null) {
            users.put(userPrincipalName, entry);
        }
        return this;
    }

    public FakeIdentityDirectory addGroup(String id, String displayName) {
        groups.put(id, new DirectoryEntry(id, displayName, null));
        return this;
    }

    /**
     * Makes every lookup return the supplied result until {@link #restore()}.
     */
    public void failWith(Supplier<CallResult<DirectoryEntry>> outage) {
        this.outage = outage;
    }

    public void restore() {
        this.outage = null;
    }

    @Override
    public CallResult<DirectoryEntry> findUser(String idOrPrincipalName) {
        userLookups.incrementAndGet();
        Supplier<CallResult<DirectoryEntry>> current = outage;
        if (current != null) {
            return current.get();
        }
        DirectoryEntry entry = users.get(idOrPrincipalName);
        return entry != null ? CallResult.success(entry) : CallResult.notFound("user not found");
    }

    @Override
    public CallResult<DirectoryEntry> findGroup(String objectId) {
        groupLookups.incrementAndGet();
        Supplier<CallResult<DirectoryEntry>> current = outage;
        if (current != null) {
            return current.get();
        }
        DirectoryEntry entry = groups.get(objectId);
        return entry != null ? CallResult.success(entry) : CallResult.notFound("group not found");
    }

    public int userLookups() {
        return userLookups.get();
    }

    public int groupLookups() {
        return groupLookups.get();
    }
}
