package com.carepulse.dto.response;

import com.carepulse.model.enums.QueueStatus;
import com.carepulse.model.scheduling.QueueTicket;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record QueueTicketDto(
    String id,
    String appointmentId,
    String patientId,
    LocalDate queueDate,
    int queueNumber,
    QueueStatus status,
    LocalDateTime checkedInAt
) {

    public static QueueTicketDto fromEntity(QueueTicket ticket) {
        return new QueueTicketDto(
            ticket.getId(),
            ticket.getAppointmentId(),
            ticket.getPatientId(),
            ticket.getQueueDate(),
            ticket.getQueueNumber(),
            ticket.getStatus(),
            ticket.getCheckedInAt()
        );
    }
}
