package com.autoviral.worker.mapper;

import com.autoviral.worker.entity.Asset;
import org.apache.ibatis.annotations.Mapper;

import java.util.Optional;

@Mapper
public interface AssetMapper {

    void insert(Asset asset);

    Optional<Asset> findById(Long assetId);
}
