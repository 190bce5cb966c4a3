package com.ryuqq.retry.core.action;

import java.util.concurrent.CompletionStage;

/**
 * 비동기 방식으로 수행되는 재시도 대상 액션.
 *
 * <p>컨트롤러는 반환된 stage가 완료될 때까지 다음 시도를 시작하지 않습니다.</p>
 *
 * <p><strong>완료 규칙:</strong></p>
 * <ul>
 *   <li>non-null 값으로 완료: 성공</li>
 *   <li>null 값으로 완료 (또는 stage 자체가 null): 아직 성공하지 못함</li>
 *   <li>예외로 완료 (또는 invoke()가 예외를 던짐): 실패</li>
 * </ul>
 *
 * @param <T> 성공 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncRetryAction<T> {

    /**
     * 액션 시작.
     *
     * @return 시도 결과로 완료될 stage
     */
    CompletionStage<T> invoke();
}
