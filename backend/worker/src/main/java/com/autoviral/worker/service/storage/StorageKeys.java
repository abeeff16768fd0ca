package com.autoviral.worker.service.storage;

/**
 * 에피소드 생성물 객체 키
 */
public final class StorageKeys {

    private StorageKeys() {
    }

    public static String episodePrefix(Long workspaceId, Long episodeId) {
        return "workspaces/" + workspaceId + "/episodes/" + episodeId + "/";
    }

    public static String sceneVoice(Long workspaceId, Long episodeId, int sceneIndex) {
        return episodePrefix(workspaceId, episodeId) + "scene_" + sceneIndex + "_voice.mp3";
    }

    public static String sceneImage(Long workspaceId, Long episodeId, int sceneIndex) {
        return episodePrefix(workspaceId, episodeId) + "scene_" + sceneIndex + ".png";
    }

    public static String voice(Long workspaceId, Long episodeId) {
        return episodePrefix(workspaceId, episodeId) + "voice.mp3";
    }

    public static String cover(Long workspaceId, Long episodeId) {
        return episodePrefix(workspaceId, episodeId) + "cover.png";
    }

    public static String video(Long workspaceId, Long episodeId) {
        return episodePrefix(workspaceId, episodeId) + "video.mp4";
    }
}
