package com.autoviral.worker.service.image;

import java.util.Optional;

/**
 * 세로형(9:16) 배경 이미지 생성
 * 이미지는 없어도 영상이 만들어지므로 실패는 빈 값으로 돌려준다.
 */
public interface ImageGeneratorService {

    Optional<byte[]> generateSceneImage(String visualDescription, int sceneIndex);

    Optional<byte[]> generateCoverImage(String scriptText);
}
