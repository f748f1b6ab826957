package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import java.util.Collection;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface TrackMapper {

    String COLUMNS = "filename, title, artist, album, album_artist, genre, track_number, duration_sec, "
            + "play_count, last_played, added";

    @Insert("INSERT INTO tracks(filename, title, artist, album, album_artist, genre, track_number, duration_sec) "
            + "VALUES(#{filename}, #{title}, #{artist}, #{album}, #{albumArtist}, #{genre}, #{trackNumber}, #{durationSec})")
    int insert(TrackEntity entity);

    @Select("SELECT " + COLUMNS + " FROM tracks WHERE filename = #{filename}")
    TrackEntity selectByFilename(@Param("filename") String filename);

    @Select("SELECT " + COLUMNS + " FROM tracks")
    List<TrackEntity> selectAll();

    @Select("SELECT filename FROM tracks")
    List<String> selectAllFilenames();

    @Update("UPDATE tracks SET duration_sec = #{durationSec} WHERE filename = #{filename}")
    int updateDuration(@Param("filename") String filename, @Param("durationSec") Integer durationSec);

    @Delete({"<script>",
            "DELETE FROM tracks WHERE filename IN",
            "<foreach collection='filenames' item='filename' open='(' separator=',' close=')'>",
            "#{filename}",
            "</foreach>",
            "</script>"})
    int deleteByFilenames(@Param("filenames") Collection<String> filenames);

    @Update("UPDATE tracks SET play_count = play_count + 1, last_played = NOW() WHERE filename = #{filename}")
    int incrementPlayCount(@Param("filename") String filename);

    @Update("UPDATE tracks SET last_played = NOW() WHERE filename = #{filename}")
    int markLastPlayed(@Param("filename") String filename);
}
