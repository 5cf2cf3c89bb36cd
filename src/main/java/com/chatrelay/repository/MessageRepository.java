package com.chatrelay.repository;

import com.chatrelay.model.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MessageRepository extends JpaRepository<ChatMessage, Long> {

    /**
     * Newest messages of a room first; page size caps the result.
     */
    @Query("SELECT m FROM ChatMessage m WHERE m.roomId = :roomId ORDER BY m.timestamp DESC, m.sequence DESC")
    List<ChatMessage> findNewestByRoomId(@Param("roomId") String roomId, Pageable pageable);
}
