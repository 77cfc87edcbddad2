package com.ryuqq.provisioner.core.protection;

import java.util.Locale;

/**
 * 서킷 브레이커를 거친 단일 호출의 결과 분류 (메트릭 태그용).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum CallOutcome {

    SUCCESS,
    FAILURE,
    TIMEOUT,
    REJECTED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
