package com.github.spud.chatagent.infrastructure.persistence.repository;

import com.github.spud.chatagent.infrastructure.persistence.entity.ChatEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChatRepository extends JpaRepository<ChatEntity, String> {

  List<ChatEntity> findAllByOrderByUpdatedAtDesc();
}
