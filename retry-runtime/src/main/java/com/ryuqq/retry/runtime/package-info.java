/**
 * Retry runtime - RetryController 구현.
 *
 * <p>이 패키지는 core의 전략/상태 머신 위에서 실제 재시도 사이클을 구동하는 컨트롤러를 포함합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.runtime.RetryController} - 단일 스레드 이벤트 루프 기반 재시도 컨트롤러</li>
 *   <li>{@link com.ryuqq.retry.runtime.RetryControllerConfig} - 컨트롤러 설정 (불변 record)</li>
 *   <li>{@link com.ryuqq.retry.runtime.StatusChannel} - 사이클별 상태 브로드캐스트 채널</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * retry-testkit (contract tests)
 *   ↓ depends on
 * retry-runtime (RetryController)
 *   ↓ depends on
 * retry-core (RetryStrategy, ActionResult, CycleState, RetryAction)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.retry.runtime;
