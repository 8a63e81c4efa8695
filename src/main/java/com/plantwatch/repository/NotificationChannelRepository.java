package com.plantwatch.repository;

import com.plantwatch.entity.NotificationChannel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationChannelRepository extends JpaRepository<NotificationChannel, UUID> {
    List<NotificationChannel> findByDestinationAndEnabledTrue(String destination);

    List<NotificationChannel> findAllByOrderByCreatedAtAsc();
}
