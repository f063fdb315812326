package com.carepulse.repository;

import com.carepulse.model.enums.QueueStatus;
import com.carepulse.model.scheduling.QueueTicket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface QueueTicketRepository extends JpaRepository<QueueTicket, String> {

    Optional<QueueTicket> findByAppointmentId(String appointmentId);

    boolean existsByAppointmentId(String appointmentId);

    List<QueueTicket> findByQueueDateOrderByQueueNumberAsc(LocalDate queueDate);

    long countByQueueDate(LocalDate queueDate);

    long countByQueueDateAndStatusInAndQueueNumberLessThan(LocalDate queueDate,
                                                          Collection<QueueStatus> statuses,
                                                          int queueNumber);
}
