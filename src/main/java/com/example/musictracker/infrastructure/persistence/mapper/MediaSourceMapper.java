package com.example.musictracker.infrastructure.persistence.mapper;

import com.example.musictracker.infrastructure.persistence.entity.MediaSourceEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface MediaSourceMapper {

    String COLUMNS = "id, collection_id, content_path, content_path_md5, dir_path, tracked, content_digest, content_type, "
            + "source_size, source_last_modified, duration_ms, bitrate, sample_rate, channels, has_artwork, "
            + "artwork_mime_type, synchronized_revision, collected_at, synchronized_at";

    @Select("SELECT " + COLUMNS + " FROM media_source "
            + "WHERE collection_id = #{collectionId} AND content_path_md5 = #{contentPathMd5}")
    MediaSourceEntity selectByPathMd5(@Param("collectionId") Long collectionId,
                                      @Param("contentPathMd5") String contentPathMd5);

    @Select("SELECT " + COLUMNS + " FROM media_source "
            + "WHERE collection_id = #{collectionId} AND content_path LIKE #{likePattern} ESCAPE '\\\\' "
            + "ORDER BY content_path")
    List<MediaSourceEntity> selectByPrefix(@Param("collectionId") Long collectionId,
                                           @Param("likePattern") String likePattern);

    @Insert("INSERT INTO media_source(collection_id, content_path, content_path_md5, dir_path, tracked, content_digest, "
            + "content_type, source_size, source_last_modified, duration_ms, bitrate, sample_rate, channels, "
            + "has_artwork, artwork_mime_type, synchronized_revision, collected_at, synchronized_at) "
            + "VALUES(#{collectionId}, #{contentPath}, #{contentPathMd5}, #{dirPath}, #{tracked}, #{contentDigest}, "
            + "#{contentType}, #{sourceSize}, #{sourceLastModified}, #{durationMs}, #{bitrate}, #{sampleRate}, "
            + "#{channels}, #{hasArtwork}, #{artworkMimeType}, #{synchronizedRevision}, #{collectedAt}, "
            + "#{synchronizedAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(MediaSourceEntity entity);

    @Update("UPDATE media_source SET content_path = #{contentPath}, content_path_md5 = #{contentPathMd5}, "
            + "dir_path = #{dirPath}, tracked = #{tracked}, content_digest = #{contentDigest}, content_type = #{contentType}, "
            + "source_size = #{sourceSize}, source_last_modified = #{sourceLastModified}, "
            + "duration_ms = #{durationMs}, bitrate = #{bitrate}, sample_rate = #{sampleRate}, "
            + "channels = #{channels}, has_artwork = #{hasArtwork}, artwork_mime_type = #{artworkMimeType}, "
            + "synchronized_revision = #{synchronizedRevision}, synchronized_at = #{synchronizedAt} "
            + "WHERE id = #{id}")
    int update(MediaSourceEntity entity);

    @Select("SELECT s.id FROM media_source s "
            + "LEFT JOIN media_tracker_directory d "
            + "ON d.collection_id = s.collection_id AND d.path_md5 = MD5(s.dir_path) "
            + "WHERE s.collection_id = #{collectionId} AND s.content_path LIKE #{likePattern} ESCAPE '\\\\' "
            + "AND (d.id IS NULL OR s.tracked = 0) ORDER BY s.id")
    List<Long> selectUntrackedIds(@Param("collectionId") Long collectionId,
                                  @Param("likePattern") String likePattern);

    @Select("SELECT s.id FROM media_source s "
            + "JOIN media_tracker_directory d "
            + "ON d.collection_id = s.collection_id AND d.path_md5 = MD5(s.dir_path) "
            + "WHERE s.collection_id = #{collectionId} AND s.content_path LIKE #{likePattern} ESCAPE '\\\\' "
            + "AND d.status = #{status} ORDER BY s.id")
    List<Long> selectIdsByDirectoryStatus(@Param("collectionId") Long collectionId,
                                          @Param("likePattern") String likePattern,
                                          @Param("status") Integer status);

    @Update({"<script>",
            "UPDATE media_source SET tracked = 0",
            "WHERE collection_id = #{collectionId} AND dir_path = #{dirPath} AND tracked = 1",
            "<if test='presentPaths != null and !presentPaths.isEmpty()'>",
            "AND content_path NOT IN",
            "<foreach collection='presentPaths' item='path' open='(' separator=',' close=')'>",
            "#{path}",
            "</foreach>",
            "</if>",
            "</script>"})
    int untrackMissingInDirectory(@Param("collectionId") Long collectionId,
                                  @Param("dirPath") String dirPath,
                                  @Param("presentPaths") List<String> presentPaths);

    @Update({"<script>",
            "UPDATE media_source SET tracked = 1",
            "WHERE collection_id = #{collectionId} AND dir_path = #{dirPath} AND tracked = 0",
            "AND content_path IN",
            "<foreach collection='presentPaths' item='path' open='(' separator=',' close=')'>",
            "#{path}",
            "</foreach>",
            "</script>"})
    int retrackPresentInDirectory(@Param("collectionId") Long collectionId,
                                  @Param("dirPath") String dirPath,
                                  @Param("presentPaths") List<String> presentPaths);

    @Delete({"<script>",
            "DELETE FROM media_source WHERE id IN ",
            "<foreach collection='ids' item='id' open='(' separator=',' close=')'>",
            "#{id}",
            "</foreach>",
            "</script>"})
    int deleteByIds(@Param("ids") List<Long> ids);

    @Update("UPDATE media_source "
            + "SET content_path = CONCAT(#{newPrefix}, SUBSTRING(content_path, CHAR_LENGTH(#{oldPrefix}) + 1)), "
            + "content_path_md5 = MD5(CONCAT(#{newPrefix}, SUBSTRING(content_path, CHAR_LENGTH(#{oldPrefix}) + 1))), "
            + "dir_path = CONCAT(#{newPrefix}, SUBSTRING(dir_path, CHAR_LENGTH(#{oldPrefix}) + 1)) "
            + "WHERE collection_id = #{collectionId} AND content_path LIKE #{likePattern} ESCAPE '\\\\'")
    int relocate(@Param("collectionId") Long collectionId,
                 @Param("likePattern") String likePattern,
                 @Param("oldPrefix") String oldPrefix,
                 @Param("newPrefix") String newPrefix);
}
