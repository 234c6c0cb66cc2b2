package com.github.spud.chatagent.infrastructure.persistence.repository;

import com.github.spud.chatagent.infrastructure.persistence.entity.ChatMemoryEntry;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChatMemoryEntryRepository extends JpaRepository<ChatMemoryEntry, Long> {

  @Query("select distinct cm.conversationId from ChatMemoryEntry cm")
  List<String> findConversationIds();

  List<ChatMemoryEntry> findAllByConversationIdOrderByIdAsc(String conversationId);

  @Modifying
  @Query("delete from ChatMemoryEntry cm where cm.conversationId = :conversationId")
  int deleteByConversationId(@Param("conversationId") String conversationId);
}
