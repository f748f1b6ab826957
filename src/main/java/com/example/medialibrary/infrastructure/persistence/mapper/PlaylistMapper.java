package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.infrastructure.persistence.entity.PlaylistEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface PlaylistMapper {

    @Insert("INSERT INTO playlists(name) VALUES(#{name})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(PlaylistEntity entity);

    @Select("SELECT id, name, created_at, updated_at FROM playlists WHERE id = #{id}")
    PlaylistEntity selectById(@Param("id") Long id);

    @Select("SELECT id, name, created_at, updated_at FROM playlists ORDER BY name ASC, id ASC")
    List<PlaylistEntity> selectAll();

    @Update("UPDATE playlists SET name = #{name} WHERE id = #{id}")
    int rename(@Param("id") Long id, @Param("name") String name);

    @Delete("DELETE FROM playlists WHERE id = #{id}")
    int deleteById(@Param("id") Long id);
}
