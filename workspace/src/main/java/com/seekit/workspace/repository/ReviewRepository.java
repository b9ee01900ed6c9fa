package com.seekit.workspace.repository;

import com.seekit.workspace.model.Review;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ReviewRepository extends JpaRepository<Review, Long> {

    /** Reviews a user has received, newest first. */
    List<Review> findByRevieweeIdOrderByCreatedAtDesc(Long revieweeId);

    boolean existsByProjectIdAndReviewerId(Long projectId, Long reviewerId);
}
