package com.example.roomchat.persistence;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RoomJpaRepository extends JpaRepository<RoomEntity, Long> {

    Optional<RoomEntity> findByName(String name);

    List<RoomEntity> findAllByOrderByIdAsc();
}
