package com.ryuqq.retry.core.action;

import java.util.concurrent.CompletableFuture;

/**
 * 동기 방식으로 수행되는 재시도 대상 액션.
 *
 * <p><strong>반환값 규칙:</strong></p>
 * <ul>
 *   <li>non-null: 성공 (사이클 종료)</li>
 *   <li>null: 아직 성공하지 못함 (오류 아님, 다음 시도 예약)</li>
 *   <li>예외: 실패 (다음 시도 예약, 오류는 shouldRetry에 전달)</li>
 * </ul>
 *
 * <p>컨트롤러의 이벤트 루프 스레드에서 호출되므로, 오래 블로킹되는 작업은
 * {@link AsyncRetryAction}으로 제공하는 것이 좋습니다.</p>
 *
 * @param <T> 성공 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryAction<T> {

    /**
     * 액션 수행.
     *
     * @return 성공 시 non-null 값, 아직 성공하지 못한 경우 null
     * @throws Exception 시도 실패 시
     */
    T call() throws Exception;

    /**
     * 비동기 액션으로 변환.
     *
     * <p>호출 즉시 call()을 수행하고, 결과 또는 예외로 완료된 stage를 반환합니다.
     * {@link Error}를 포함한 모든 Throwable이 실패한 stage로 전달됩니다.</p>
     *
     * @return AsyncRetryAction
     */
    default AsyncRetryAction<T> toAsync() {
        return () -> {
            try {
                return CompletableFuture.completedFuture(call());
            } catch (Throwable t) {
                return CompletableFuture.failedFuture(t);
            }
        };
    }
}
