package com.autoviral.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * 에피소드 생애주기 상태
 *
 * SCHEDULED → GENERATING → READY_FOR_REVIEW → (APPROVED) → POSTED
 * GENERATING, READY_FOR_REVIEW 에서 단계 오류 시 FAILED,
 * FAILED 는 스크립트/미디어 재실행으로 다시 GENERATING 이 된다.
 */
@Getter
@RequiredArgsConstructor
public enum EpisodeStatus {

    SCHEDULED("scheduled", "예약됨"),
    GENERATING("generating", "생성중"),
    READY_FOR_REVIEW("ready_for_review", "검토 대기"),
    APPROVED("approved", "승인됨"),
    POSTED("posted", "게시됨"),
    FAILED("failed", "실패");

    private final String code;
    private final String description;

    public Set<EpisodeStatus> nextStatuses() {
        switch (this) {
            case SCHEDULED:
                return EnumSet.of(GENERATING);
            case GENERATING:
                // 재전달된 작업이 같은 상태에서 다시 시작될 수 있다
                return EnumSet.of(GENERATING, READY_FOR_REVIEW, FAILED);
            case READY_FOR_REVIEW:
                return EnumSet.of(GENERATING, APPROVED, POSTED, FAILED);
            case APPROVED:
                return EnumSet.of(POSTED);
            case FAILED:
                return EnumSet.of(GENERATING);
            default:
                return EnumSet.noneOf(EpisodeStatus.class);
        }
    }

    public boolean canTransitionTo(EpisodeStatus target) {
        return nextStatuses().contains(target);
    }

    /**
     * 스크립트 생성을 (재)시작할 수 있는 상태
     */
    public boolean canStartScript() {
        return this == SCHEDULED || this == FAILED;
    }

    /**
     * 미디어 생성을 (재)시작할 수 있는 상태
     */
    public boolean canStartMedia() {
        return this == READY_FOR_REVIEW || this == GENERATING || this == FAILED;
    }
}
