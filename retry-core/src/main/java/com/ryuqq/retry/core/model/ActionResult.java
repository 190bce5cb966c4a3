package com.ryuqq.retry.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * execute() 호출 결과.
 *
 * <p>사이클 하나당 정확히 하나의 ActionResult가 만들어지며, 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>생성 경로 (정적 팩토리만 허용):</strong></p>
 * <ul>
 *   <li>{@link #skip()}: 이미 사이클이 진행 중일 때 (status = ATTEMPT, data 없음)</li>
 *   <li>{@link #fail()}: 시도 소진 (status = FAIL, data 없음)</li>
 *   <li>{@link #success(Object)}: 액션이 non-null 값 반환 (status = SUCCESS, data 포함)</li>
 *   <li>{@link #canceled()}: cancel() 또는 외부 stop()으로 사이클 중단 (status = CANCELED, data 없음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ActionResult&lt;String&gt; result = controller.execute(this::fetch).join();
 * if (result.isSuccess()) {
 *     String body = result.data();
 * }
 * </pre>
 *
 * @param <T> 성공 데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ActionResult<T> {

    private final RetryStatus status;
    private final T data;

    private ActionResult(RetryStatus status, T data) {
        this.status = status;
        this.data = data;
    }

    /**
     * 진행 중인 사이클이 있어 새 사이클을 시작하지 않았음을 나타내는 결과.
     *
     * @param <T> 성공 데이터 타입
     * @return status = ATTEMPT
     */
    public static <T> ActionResult<T> skip() {
        return new ActionResult<>(RetryStatus.ATTEMPT, null);
    }

    /**
     * 모든 시도가 실패했음을 나타내는 결과.
     *
     * @param <T> 성공 데이터 타입
     * @return status = FAIL
     */
    public static <T> ActionResult<T> fail() {
        return new ActionResult<>(RetryStatus.FAIL, null);
    }

    /**
     * 사이클이 취소되었음을 나타내는 결과.
     *
     * @param <T> 성공 데이터 타입
     * @return status = CANCELED
     */
    public static <T> ActionResult<T> canceled() {
        return new ActionResult<>(RetryStatus.CANCELED, null);
    }

    /**
     * 성공 결과 생성.
     *
     * @param data 액션이 반환한 값
     * @param <T> 성공 데이터 타입
     * @return status = SUCCESS
     * @throws IllegalArgumentException data가 null인 경우
     */
    public static <T> ActionResult<T> success(T data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null for success result");
        }
        return new ActionResult<>(RetryStatus.SUCCESS, data);
    }

    public RetryStatus status() {
        return status;
    }

    /**
     * 성공 데이터 조회.
     *
     * <p><strong>주의:</strong> status가 SUCCESS인 경우에만 non-null 반환</p>
     *
     * @return 성공 데이터 또는 null
     */
    public T data() {
        return data;
    }

    public Optional<T> dataOptional() {
        return Optional.ofNullable(data);
    }

    public boolean isSuccess() {
        return status == RetryStatus.SUCCESS;
    }

    public boolean isSkipped() {
        return status == RetryStatus.ATTEMPT;
    }

    public boolean isFailed() {
        return status == RetryStatus.FAIL;
    }

    public boolean isCanceled() {
        return status == RetryStatus.CANCELED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActionResult<?> other)) {
            return false;
        }
        return status == other.status && Objects.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, data);
    }

    @Override
    public String toString() {
        if (data == null) {
            return "ActionResult{status=" + status + "}";
        }
        return "ActionResult{status=" + status + ", data=" + data + "}";
    }
}
