package com.relaymail.mapper;

import com.relaymail.domain.ApiKey;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface ApiKeyMapper {

    List<ApiKey> findActiveByUserId(@Param("userId") String userId);

    List<ApiKey> findActiveByPrefix(@Param("keyPrefix") String keyPrefix);

    int updateLastUsed(@Param("id") String id, @Param("lastUsedAt") Instant lastUsedAt);
}
