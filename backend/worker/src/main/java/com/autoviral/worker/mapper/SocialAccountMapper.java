package com.autoviral.worker.mapper;

import com.autoviral.worker.entity.SocialAccount;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;
import java.util.Optional;

@Mapper
public interface SocialAccountMapper {

    Optional<SocialAccount> findById(Long socialAccountId);

    List<SocialAccount> findConnectedByWorkspaceId(Long workspaceId);
}
