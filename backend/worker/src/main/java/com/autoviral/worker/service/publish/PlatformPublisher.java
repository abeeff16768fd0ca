package com.autoviral.worker.service.publish;

import com.autoviral.common.enums.Platform;
import com.autoviral.worker.dto.PublishDto;

/**
 * 플랫폼별 영상 게시 어댑터
 *
 * 실패는 ApiException 으로 알린다.
 * PLATFORM_REJECTED(4xx 응답, 프로토콜 오류)와 PLATFORM_PUBLISH_FAILED(5xx, 네트워크) 모두 큐 재시도 대상이다.
 */
public interface PlatformPublisher {

    Platform getPlatform();

    PublishDto.Attempt publish(PublishDto.Request request);
}
