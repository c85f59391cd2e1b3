package com.eyelevel.demandletter.repository;

import com.eyelevel.demandletter.model.ChatMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@link ChatMessage} entity.
 */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    List<ChatMessage> findAllByOrderByIdAsc();

    /**
     * Sets the bot response if it has not been set yet. Returns 0 when the row is unknown or already filled.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ChatMessage c SET c.botResponse = :response WHERE c.id = :id AND c.botResponse IS NULL")
    int fillResponseIfEmpty(@Param("id") Long id, @Param("response") String response);
}
