package com.autoviral.worker.entity;

import com.autoviral.common.enums.Platform;
import com.autoviral.common.enums.SocialAccountStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SocialAccount {
    private Long socialAccountId;
    private Long workspaceId;
    private Platform platform;
    private String displayName;
    private SocialAccountStatus status;
    private String accessToken;     // 암호화된 값
}
