package com.relaymail.mapper;

import com.relaymail.domain.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface UserMapper {

    /**
     * Case-insensitive lookup by primary or additional address
     */
    User findByEmail(@Param("email") String email);
}
