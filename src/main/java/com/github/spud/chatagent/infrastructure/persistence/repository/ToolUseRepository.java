package com.github.spud.chatagent.infrastructure.persistence.repository;

import com.github.spud.chatagent.infrastructure.persistence.entity.ToolUseEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ToolUseRepository extends JpaRepository<ToolUseEntity, String> {

  List<ToolUseEntity> findAllByChatIdOrderByCreatedAtAsc(String chatId);

  @Modifying
  @Query("delete from ToolUseEntity t where t.chatId = :chatId")
  int deleteByChatId(@Param("chatId") String chatId);
}
