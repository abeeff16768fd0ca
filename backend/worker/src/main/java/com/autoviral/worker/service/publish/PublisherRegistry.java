package com.autoviral.worker.service.publish;

import com.autoviral.common.enums.Platform;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 플랫폼 → 게시 어댑터
 */
@Component
public class PublisherRegistry {

    private final Map<Platform, PlatformPublisher> publishers = new EnumMap<>(Platform.class);

    public PublisherRegistry(List<PlatformPublisher> platformPublishers) {
        for (PlatformPublisher publisher : platformPublishers) {
            if (publishers.put(publisher.getPlatform(), publisher) != null) {
                throw new IllegalStateException("Duplicate publisher for " + publisher.getPlatform());
            }
        }
    }

    public Optional<PlatformPublisher> find(Platform platform) {
        return platform == null ? Optional.empty() : Optional.ofNullable(publishers.get(platform));
    }
}
