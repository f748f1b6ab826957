package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.infrastructure.persistence.entity.QueueItemEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface QueueItemMapper {

    @Insert("INSERT INTO playback_queue(position, track_filename, youtube_video_id) "
            + "VALUES(#{position}, #{trackFilename}, #{youtubeVideoId})")
    int insert(@Param("position") int position,
               @Param("trackFilename") String trackFilename,
               @Param("youtubeVideoId") Long youtubeVideoId);

    @Select("SELECT MAX(position) FROM playback_queue")
    Integer selectMaxPosition();

    @Select("SELECT id, position, track_filename, youtube_video_id, added_at "
            + "FROM playback_queue ORDER BY position ASC, id ASC")
    List<QueueItemEntity> selectAllOrdered();

    @Delete("DELETE FROM playback_queue WHERE id = #{id}")
    int deleteById(@Param("id") Long id);

    @Delete("DELETE FROM playback_queue WHERE track_filename = #{filename}")
    int deleteByTrack(@Param("filename") String filename);

    @Delete("DELETE FROM playback_queue WHERE youtube_video_id = #{videoId}")
    int deleteByVideo(@Param("videoId") Long videoId);

    @Delete("DELETE FROM playback_queue")
    int deleteAll();

    @Update("UPDATE playback_queue SET position = #{position} WHERE id = #{id}")
    int updatePosition(@Param("id") Long id, @Param("position") int position);

    @Select("SELECT COUNT(1) FROM playback_queue")
    int count();
}
