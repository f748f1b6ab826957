package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.infrastructure.persistence.entity.VideoEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface VideoMapper {

    String COLUMNS = "id, video_id, channel_id, title, duration_sec, thumbnail_url, published_at, fetched_at, "
            + "play_count, last_played, added";

    @Insert("INSERT IGNORE INTO youtube_videos(video_id, channel_id, title, duration_sec, thumbnail_url, published_at, added) "
            + "VALUES(#{videoId}, #{channelId}, #{title}, #{durationSec}, #{thumbnailUrl}, #{publishedAt}, NOW())")
    int insertIgnore(VideoEntity entity);

    @Select("SELECT " + COLUMNS + " FROM youtube_videos WHERE id = #{id}")
    VideoEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM youtube_videos")
    List<VideoEntity> selectAll();

    @Select("SELECT " + COLUMNS + " FROM youtube_videos WHERE channel_id = #{channelId} "
            + "ORDER BY published_at DESC, id DESC")
    List<VideoEntity> selectByChannelId(@Param("channelId") Long channelId);

    @Update("UPDATE youtube_videos SET play_count = play_count + 1, last_played = NOW() WHERE id = #{id}")
    int incrementPlayCount(@Param("id") Long id);

    @Update("UPDATE youtube_videos SET last_played = NOW() WHERE id = #{id}")
    int markLastPlayed(@Param("id") Long id);
}
