package com.autoviral.worker.service.storage;

/**
 * 생성물 저장소
 * 저장 후 돌려주는 URL 이 에셋의 위치(asset.url)가 되고, 외부에서 가져가야 할 때는
 * {@link #fetchableUrl(String, long)} 로 기한부 URL 을 만든다.
 */
public interface StorageService {

    /**
     * 저장소가 설정되지 않았을 때 쓰는 자리표시 URL 접두어. 외부 플랫폼은 이 URL 을 가져갈 수 없다.
     */
    String PLACEHOLDER_URL_PREFIX = "https://storage.example.com/";

    /**
     * @return 저장된 객체의 URL
     */
    String upload(String key, byte[] data, String contentType);

    /**
     * 저장 URL → 외부에서 GET 가능한 URL (비공개 버킷이면 presigned)
     */
    String fetchableUrl(String storedUrl, long ttlSeconds);

    byte[] download(String storedUrl);

    boolean isEnabled();

    static boolean isPlaceholder(String url) {
        return url == null || url.isBlank() || url.startsWith(PLACEHOLDER_URL_PREFIX);
    }
}
