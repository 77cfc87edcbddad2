package com.ryuqq.provisioner.application.workflow;

import java.time.Duration;

/**
 * 폴링 루프의 대기 전략. 테스트에서는 시계를 움직이는 구현으로 바꿉니다.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
