package com.example.musictracker.infrastructure.persistence.mapper;

import com.example.musictracker.infrastructure.persistence.entity.TrackedDirectoryEntity;
import com.example.musictracker.infrastructure.persistence.model.StatusCountRow;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface TrackedDirectoryMapper {

    String COLUMNS = "id, collection_id, path, path_md5, digest, status, created_at, updated_at";

    @Select("SELECT " + COLUMNS + " FROM media_tracker_directory "
            + "WHERE collection_id = #{collectionId} AND path_md5 = #{pathMd5}")
    TrackedDirectoryEntity selectByPathMd5(@Param("collectionId") Long collectionId,
                                           @Param("pathMd5") String pathMd5);

    @Insert("INSERT INTO media_tracker_directory(collection_id, path, path_md5, digest, status, created_at, updated_at) "
            + "VALUES(#{collectionId}, #{path}, #{pathMd5}, #{digest}, #{status}, NOW(3), NOW(3))")
    int insert(TrackedDirectoryEntity entity);

    @Update("UPDATE media_tracker_directory SET digest = #{digest}, status = #{status}, updated_at = NOW(3) "
            + "WHERE collection_id = #{collectionId} AND path_md5 = #{pathMd5}")
    int update(TrackedDirectoryEntity entity);

    @Update("UPDATE media_tracker_directory SET status = #{status}, updated_at = NOW(3) "
            + "WHERE collection_id = #{collectionId} AND path_md5 = #{pathMd5}")
    int updateStatus(@Param("collectionId") Long collectionId,
                     @Param("pathMd5") String pathMd5,
                     @Param("status") Integer status);

    @Update("UPDATE media_tracker_directory SET status = #{status}, updated_at = NOW(3) "
            + "WHERE collection_id = #{collectionId} AND path_md5 = #{pathMd5} AND digest = #{digest}")
    int updateStatusIfDigest(@Param("collectionId") Long collectionId,
                             @Param("pathMd5") String pathMd5,
                             @Param("digest") byte[] digest,
                             @Param("status") Integer status);

    @Select("SELECT " + COLUMNS + " FROM media_tracker_directory "
            + "WHERE collection_id = #{collectionId} AND path LIKE #{likePattern} ESCAPE '\\\\' "
            + "ORDER BY path")
    List<TrackedDirectoryEntity> selectByPrefix(@Param("collectionId") Long collectionId,
                                                @Param("likePattern") String likePattern);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM media_tracker_directory "
            + "WHERE collection_id = #{collectionId} AND path LIKE #{likePattern} ESCAPE '\\\\' "
            + "AND status IN "
            + "<foreach item='status' collection='statuses' open='(' separator=',' close=')'>"
            + "#{status}"
            + "</foreach>"
            + " ORDER BY updated_at ASC, id ASC LIMIT #{limit} OFFSET #{offset}"
            + "</script>")
    List<TrackedDirectoryEntity> selectByStatusIn(@Param("collectionId") Long collectionId,
                                                  @Param("likePattern") String likePattern,
                                                  @Param("statuses") List<Integer> statuses,
                                                  @Param("offset") int offset,
                                                  @Param("limit") int limit);

    @Delete("<script>"
            + "DELETE FROM media_tracker_directory "
            + "WHERE collection_id = #{collectionId} AND path LIKE #{likePattern} ESCAPE '\\\\' "
            + "<if test='status != null'> AND status = #{status}</if>"
            + "</script>")
    int deleteByPrefix(@Param("collectionId") Long collectionId,
                       @Param("likePattern") String likePattern,
                       @Param("status") Integer status);

    @Select("SELECT status, COUNT(*) AS cnt FROM media_tracker_directory "
            + "WHERE collection_id = #{collectionId} AND path LIKE #{likePattern} ESCAPE '\\\\' "
            + "GROUP BY status")
    List<StatusCountRow> countByStatus(@Param("collectionId") Long collectionId,
                                       @Param("likePattern") String likePattern);

    @Update("UPDATE media_tracker_directory "
            + "SET path = CONCAT(#{newPrefix}, SUBSTRING(path, CHAR_LENGTH(#{oldPrefix}) + 1)), "
            + "path_md5 = MD5(CONCAT(#{newPrefix}, SUBSTRING(path, CHAR_LENGTH(#{oldPrefix}) + 1))) "
            + "WHERE collection_id = #{collectionId} AND path LIKE #{likePattern} ESCAPE '\\\\'")
    int relocate(@Param("collectionId") Long collectionId,
                 @Param("likePattern") String likePattern,
                 @Param("oldPrefix") String oldPrefix,
                 @Param("newPrefix") String newPrefix);
}
