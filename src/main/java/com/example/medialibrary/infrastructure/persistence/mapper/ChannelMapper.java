package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.infrastructure.persistence.entity.ChannelEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ChannelMapper {

    @Insert("INSERT INTO youtube_channels(channel_id, name, handle, url, thumbnail_url) "
            + "VALUES(#{channelId}, #{name}, #{handle}, #{url}, #{thumbnailUrl})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(ChannelEntity entity);

    @Select("SELECT id, channel_id, name, handle, url, thumbnail_url, last_fetched, created_at "
            + "FROM youtube_channels WHERE id = #{id}")
    ChannelEntity selectById(@Param("id") Long id);

    @Select("SELECT id, channel_id, name, handle, url, thumbnail_url, last_fetched, created_at "
            + "FROM youtube_channels ORDER BY name ASC, id ASC")
    List<ChannelEntity> selectAll();

    @Delete("DELETE FROM youtube_channels WHERE id = #{id}")
    int deleteById(@Param("id") Long id);

    @Update("UPDATE youtube_channels SET last_fetched = NOW() WHERE id = #{id}")
    int touchLastFetched(@Param("id") Long id);
}
