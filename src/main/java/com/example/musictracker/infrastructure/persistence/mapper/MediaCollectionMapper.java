package com.example.musictracker.infrastructure.persistence.mapper;

import com.example.musictracker.infrastructure.persistence.entity.MediaCollectionEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface MediaCollectionMapper {

    @Insert("INSERT INTO media_collection(uid, title, root_url) VALUES(#{uid}, #{title}, #{rootUrl})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(MediaCollectionEntity entity);

    @Select("SELECT id, uid, title, root_url, created_at, updated_at FROM media_collection WHERE uid = #{uid}")
    MediaCollectionEntity selectByUid(@Param("uid") String uid);

    @Select("SELECT id, uid, title, root_url, created_at, updated_at FROM media_collection ORDER BY id")
    List<MediaCollectionEntity> selectAll();
}
