package com.autoviral.common.enums;

public enum AssetType {
    VIDEO,
    AUDIO,
    IMAGE,
    MUSIC,
    CAPTION_FILE
}
