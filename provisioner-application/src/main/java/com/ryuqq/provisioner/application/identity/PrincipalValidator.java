package com.ryuqq.provisioner.application.identity;

import com.ryuqq.provisioner.core.model.IdentityPrincipal;
import com.ryuqq.provisioner.core.result.CallResult;

/**
 * 디렉터리 주체 검증기.
 *
 * <p>결과는 예외 대신 {@link CallResult} 로 반환합니다.</p>
 * <ul>
 *   <li>Success: 디렉터리에서 확인된 주체</li>
 *   <li>NotFound: 주체가 존재하지 않음 (정상 부정 결과)</li>
 *   <li>Unauthenticated: 디렉터리 자격 증명 문제</li>
 *   <li>ServiceError: 디렉터리 이용 불가 (브레이커 OPEN, 전송 실패, 타임아웃)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface PrincipalValidator {

    /**
     * 객체 ID 로 주체 검증. 사용자 조회 후 NotFound 인 경우에만 그룹 조회로 폴백합니다.
     *
     * @param objectId 디렉터리 객체 ID
     * @return 검증 결과
     * @throws IllegalArgumentException objectId 가 null 이거나 빈 문자열인 경우
     */
    CallResult<IdentityPrincipal> validateById(String objectId);

    /**
     * 사용자 주체 이름(UPN) 또는 객체 ID 로 사용자 검증.
     */
    CallResult<IdentityPrincipal> validateUser(String principalName);

    /**
     * 객체 ID 로 그룹 검증.
     */
    CallResult<IdentityPrincipal> validateGroup(String objectId);
}
