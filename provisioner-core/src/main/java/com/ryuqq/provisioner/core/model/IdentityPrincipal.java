package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.spi.DirectoryEntry;

import java.util.Objects;
import java.util.Optional;

/**
 * 디렉터리 조회로 확인된 주체 (사용자 또는 그룹).
 *
 * <p>검증되지 않은 입력으로는 생성할 수 없습니다. 유일한 생성 경로는
 * 디렉터리 응답({@link DirectoryEntry})을 받는 {@link #verified(DirectoryEntry, PrincipalType)} 입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class IdentityPrincipal {

    private final String objectId;
    private final String displayName;
    private final PrincipalType principalType;
    private final String userPrincipalName;

    private IdentityPrincipal(DirectoryEntry entry, PrincipalType principalType) {
        this.objectId = entry.id();
        this.displayName = entry.displayName();
        this.principalType = principalType;
        this.userPrincipalName = principalType == PrincipalType.USER ? entry.userPrincipalName() : null;
    }

    /**
     * 디렉터리 조회 결과로부터 검증된 주체 생성.
     *
     * @param entry 디렉터리가 반환한 항목
     * @param principalType 조회한 컬렉션 종류
     * @return 검증된 주체
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static IdentityPrincipal verified(DirectoryEntry entry, PrincipalType principalType) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        if (principalType == null) {
            throw new IllegalArgumentException("principalType cannot be null");
        }
        return new IdentityPrincipal(entry, principalType);
    }

    public String getObjectId() {
        return objectId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public PrincipalType getPrincipalType() {
        return principalType;
    }

    /**
     * 디렉터리 조회를 통해서만 생성되므로 항상 true.
     */
    public boolean isVerified() {
        return true;
    }

    public Optional<String> getUserPrincipalName() {
        return Optional.ofNullable(userPrincipalName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdentityPrincipal that = (IdentityPrincipal) o;
        return objectId.equals(that.objectId) && principalType == that.principalType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectId, principalType);
    }

    @Override
    public String toString() {
        return "IdentityPrincipal{objectId='" + objectId + "', type=" + principalType + '}';
    }
}
