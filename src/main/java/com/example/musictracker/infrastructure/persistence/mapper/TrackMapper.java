package com.example.musictracker.infrastructure.persistence.mapper;

import com.example.musictracker.infrastructure.persistence.entity.TrackEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface TrackMapper {

    String COLUMNS = "id, uid, revision, media_source_id, title, artist, album, album_artist, composer, track_no, "
            + "disc_no, year, genre, comment, bpm, musical_key, created_at, updated_at";

    @Select("SELECT " + COLUMNS + " FROM track WHERE uid = #{uid}")
    TrackEntity selectByUid(@Param("uid") String uid);

    @Select("SELECT " + COLUMNS + " FROM track WHERE media_source_id = #{mediaSourceId}")
    TrackEntity selectByMediaSourceId(@Param("mediaSourceId") Long mediaSourceId);

    @Insert("INSERT INTO track(uid, revision, media_source_id, title, artist, album, album_artist, composer, "
            + "track_no, disc_no, year, genre, comment, bpm, musical_key, created_at, updated_at) "
            + "VALUES(#{uid}, #{revision}, #{mediaSourceId}, #{title}, #{artist}, #{album}, #{albumArtist}, "
            + "#{composer}, #{trackNo}, #{discNo}, #{year}, #{genre}, #{comment}, #{bpm}, #{musicalKey}, "
            + "#{createdAt}, #{updatedAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(TrackEntity entity);

    @Update("UPDATE track SET revision = #{entity.revision}, title = #{entity.title}, artist = #{entity.artist}, "
            + "album = #{entity.album}, album_artist = #{entity.albumArtist}, composer = #{entity.composer}, "
            + "track_no = #{entity.trackNo}, disc_no = #{entity.discNo}, year = #{entity.year}, "
            + "genre = #{entity.genre}, comment = #{entity.comment}, bpm = #{entity.bpm}, "
            + "musical_key = #{entity.musicalKey}, updated_at = #{entity.updatedAt} "
            + "WHERE id = #{entity.id} AND revision = #{expectedRevision}")
    int updateIfRevision(@Param("entity") TrackEntity entity, @Param("expectedRevision") Long expectedRevision);

    @Delete({"<script>",
            "DELETE FROM track WHERE media_source_id IN ",
            "<foreach collection='mediaSourceIds' item='mediaSourceId' open='(' separator=',' close=')'>",
            "#{mediaSourceId}",
            "</foreach>",
            "</script>"})
    int deleteByMediaSourceIds(@Param("mediaSourceIds") List<Long> mediaSourceIds);
}
