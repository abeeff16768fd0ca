package com.autoviral.common.enums;

public enum SocialAccountStatus {
    CONNECTED,
    EXPIRED,
    ERROR,
    LIMITED
}
