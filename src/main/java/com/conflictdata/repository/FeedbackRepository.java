package com.conflictdata.repository;

import com.conflictdata.model.Feedback;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FeedbackRepository extends JpaRepository<Feedback, Long> {

    @Query("SELECT f FROM Feedback f JOIN FETCH f.author WHERE f.region = :region ORDER BY f.createdAt DESC, f.id DESC")
    List<Feedback> findByRegionNewestFirst(@Param("region") String region);

    List<Feedback> findByAuthorId(Long authorId);

    List<Feedback> findByConflictRecordId(Long conflictRecordId);
}
