package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.infrastructure.persistence.entity.PlaylistItemEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface PlaylistItemMapper {

    @Insert("INSERT INTO playlist_items(playlist_id, track_filename, youtube_video_id, position) "
            + "VALUES(#{playlistId}, #{trackFilename}, #{youtubeVideoId}, #{position})")
    int insert(@Param("playlistId") Long playlistId,
               @Param("position") int position,
               @Param("trackFilename") String trackFilename,
               @Param("youtubeVideoId") Long youtubeVideoId);

    @Select("SELECT MAX(position) FROM playlist_items WHERE playlist_id = #{playlistId}")
    Integer selectMaxPosition(@Param("playlistId") Long playlistId);

    @Select("SELECT id, playlist_id, track_filename, youtube_video_id, position, added_at "
            + "FROM playlist_items WHERE playlist_id = #{playlistId} "
            + "ORDER BY position ASC, id ASC")
    List<PlaylistItemEntity> selectByPlaylistIdOrdered(@Param("playlistId") Long playlistId);

    @Delete("DELETE FROM playlist_items WHERE playlist_id = #{playlistId} AND id = #{id}")
    int deleteById(@Param("playlistId") Long playlistId, @Param("id") Long id);

    @Delete("DELETE FROM playlist_items WHERE playlist_id = #{playlistId} AND track_filename = #{filename}")
    int deleteByTrack(@Param("playlistId") Long playlistId, @Param("filename") String filename);

    @Delete("DELETE FROM playlist_items WHERE playlist_id = #{playlistId} AND youtube_video_id = #{videoId}")
    int deleteByVideo(@Param("playlistId") Long playlistId, @Param("videoId") Long videoId);

    @Delete("DELETE FROM playlist_items WHERE playlist_id = #{playlistId}")
    int deleteByPlaylistId(@Param("playlistId") Long playlistId);

    @Update("UPDATE playlist_items SET position = #{position} WHERE playlist_id = #{playlistId} AND id = #{id}")
    int updatePosition(@Param("playlistId") Long playlistId, @Param("id") Long id, @Param("position") int position);

    @Select("SELECT COUNT(1) FROM playlist_items WHERE playlist_id = #{playlistId}")
    int countByPlaylistId(@Param("playlistId") Long playlistId);
}
