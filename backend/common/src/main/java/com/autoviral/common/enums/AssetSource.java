package com.autoviral.common.enums;

public enum AssetSource {
    GENERATED,
    UPLOADED,
    EXTERNAL_URL
}
