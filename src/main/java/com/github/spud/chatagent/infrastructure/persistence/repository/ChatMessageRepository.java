package com.github.spud.chatagent.infrastructure.persistence.repository;

import com.github.spud.chatagent.infrastructure.persistence.entity.ChatMessageEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChatMessageRepository extends JpaRepository<ChatMessageEntity, Long> {

  List<ChatMessageEntity> findAllByChatIdOrderByIdAsc(String chatId);

  /**
   * 内容包含关键字（忽略大小写）的消息，最近更新的聊天在前
   */
  @Query("""
    select m from ChatMessageEntity m, ChatEntity c
    where m.chatId = c.id and lower(m.content) like lower(concat('%', :q, '%'))
    order by c.updatedAt desc, m.id asc
    """)
  List<ChatMessageEntity> searchByContent(@Param("q") String query, Pageable pageable);

  @Modifying
  @Query("""
    delete from MessageImageEntity i
    where i.message.id in (select m.id from ChatMessageEntity m where m.chatId = :chatId)
    """)
  int deleteImagesByChatId(@Param("chatId") String chatId);

  @Modifying
  @Query("delete from ChatMessageEntity m where m.chatId = :chatId")
  int deleteByChatId(@Param("chatId") String chatId);

  /**
   * 先删图片再删消息
   */
  default int deleteAllOfChat(String chatId) {
    deleteImagesByChatId(chatId);
    return deleteByChatId(chatId);
  }
}
