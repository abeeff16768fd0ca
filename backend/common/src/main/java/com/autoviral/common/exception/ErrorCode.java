package com.autoviral.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "서버 내부 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "잘못된 요청입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C005", "리소스를 찾을 수 없습니다."),

    // Series
    SERIES_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "시리즈를 찾을 수 없습니다."),
    SERIES_INVALID_STATUS(HttpStatus.CONFLICT, "S002", "현재 상태에서는 시리즈를 시작할 수 없습니다."),
    SERIES_INCOMPLETE(HttpStatus.BAD_REQUEST, "S003", "시리즈 설정이 완료되지 않았습니다."),

    // Episode
    EPISODE_NOT_FOUND(HttpStatus.NOT_FOUND, "E001", "에피소드를 찾을 수 없습니다."),
    EPISODE_INVALID_STATUS(HttpStatus.CONFLICT, "E002", "현재 상태에서는 요청한 작업을 수행할 수 없습니다."),
    EPISODE_NO_VIDEO(HttpStatus.CONFLICT, "E004", "렌더링된 영상이 없습니다."),

    // Script
    SCRIPT_NOT_FOUND(HttpStatus.NOT_FOUND, "SC001", "스크립트를 찾을 수 없습니다."),
    SCRIPT_GENERATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "SC002", "스크립트 생성에 실패했습니다."),
    SCRIPT_INVALID_SCENES(HttpStatus.BAD_GATEWAY, "SC003", "생성된 씬 형식이 올바르지 않습니다."),
    SCRIPT_SCENES_CORRUPTED(HttpStatus.UNPROCESSABLE_ENTITY, "SC004", "저장된 대본의 씬 데이터가 올바르지 않습니다."),

    // Media
    TTS_GENERATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "M001", "음성 생성에 실패했습니다."),
    IMAGE_GENERATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "M002", "이미지 생성에 실패했습니다."),
    MEDIA_MANIFEST_MISSING(HttpStatus.CONFLICT, "M004", "미디어 매니페스트가 없습니다."),

    // Video
    VIDEO_COMPOSITION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "V001", "영상 합성에 실패했습니다."),
    VIDEO_COMPOSITION_NO_SCENES(HttpStatus.BAD_REQUEST, "V002", "합성할 씬이 없습니다."),
    MEDIA_TOOL_NOT_FOUND(HttpStatus.SERVICE_UNAVAILABLE, "V003", "워커에 ffmpeg가 설치되어 있지 않습니다."),

    // Storage
    STORAGE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "ST001", "파일 저장에 실패했습니다."),

    // Publish
    SOCIAL_ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND, "P001", "소셜 계정을 찾을 수 없습니다."),
    PLATFORM_UNSUPPORTED(HttpStatus.BAD_REQUEST, "P003", "지원하지 않는 플랫폼입니다."),
    PLATFORM_PUBLISH_FAILED(HttpStatus.BAD_GATEWAY, "P004", "플랫폼 게시에 실패했습니다."),
    PLATFORM_REJECTED(HttpStatus.BAD_GATEWAY, "P005", "플랫폼이 게시 요청을 거부했습니다."),
    SOCIAL_TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "P006", "소셜 계정 토큰이 없거나 유효하지 않습니다."),
    VIDEO_URL_UNAVAILABLE(HttpStatus.CONFLICT, "P007", "외부에서 접근 가능한 영상 URL이 없습니다."),

    // AI Service
    AI_SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "A001", "AI 서비스를 사용할 수 없습니다."),
    AI_API_KEY_INVALID(HttpStatus.UNAUTHORIZED, "A003", "API 키가 유효하지 않습니다. 설정을 확인해주세요.");

    private final HttpStatus status;
    private final String code;
    private final String message;

    /**
     * 재시도로 해결될 수 있는 오류인지 여부.
     * 4xx 계열(입력/상태 오류)은 다시 실행해도 결과가 같으므로 재시도하지 않는다.
     * 외부 서비스가 돌려준 잘못된 응답(생성 결과 형식 오류, 플랫폼 거부)은 502 로 두어 재시도 대상이다.
     */
    public boolean isRetryable() {
        return !status.is4xxClientError();
    }
}
