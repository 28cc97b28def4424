package com.ryuqq.handover.core.model;

import java.util.UUID;

/**
 * 지연 실행 큐에 등록된 작업(step)의 식별자.
 *
 * <p>같은 step이 폴링을 위해 재예약되는 동안에는 TaskId가 유지되고,
 * 다음 단계로 진행할 때 새 TaskId가 발급됩니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public final class TaskId {

    private final String value;

    private TaskId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskId cannot be null or blank");
        }
        this.value = value;
    }

    public static TaskId of(String value) {
        return new TaskId(value);
    }

    /**
     * 무작위 TaskId 생성.
     *
     * @return 새 TaskId
     */
    public static TaskId random() {
        return new TaskId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskId taskId = (TaskId) o;
        return value.equals(taskId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TaskId{" + value + '}';
    }
}
