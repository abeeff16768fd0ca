package com.autoviral.worker.mapper;

import com.autoviral.worker.entity.Script;
import org.apache.ibatis.annotations.Mapper;

import java.util.Optional;

@Mapper
public interface ScriptMapper {

    void insert(Script script);

    Optional<Script> findById(Long scriptId);
}
