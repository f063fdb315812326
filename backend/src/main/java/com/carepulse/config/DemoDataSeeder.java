package com.carepulse.config;

import com.carepulse.dto.request.CreateAppointmentRequest;
import com.carepulse.dto.request.CreateDoctorRequest;
import com.carepulse.dto.request.CreatePatientRequest;
import com.carepulse.model.clinic.Doctor;
import com.carepulse.model.clinic.Patient;
import com.carepulse.model.enums.AppointmentStatus;
import com.carepulse.model.enums.AppointmentType;
import com.carepulse.model.enums.UserRole;
import com.carepulse.model.id.AppointmentId;
import com.carepulse.model.scheduling.Appointment;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.model.value.PhoneNumber;
import com.carepulse.repository.UserAccountRepository;
import com.carepulse.service.AppointmentService;
import com.carepulse.service.DoctorService;
import com.carepulse.service.PatientService;
import com.carepulse.service.UserAccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * Creates a demo clinic on startup: one staff login, three doctors, five patients
 * and a handful of appointments on the next working day. Skipped when the staff
 * account already exists.
 */
@Component
@ConditionalOnProperty(name = "carepulse.seed-demo-data", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DemoDataSeeder implements ApplicationRunner {

    static final String STAFF_EMAIL = "staff@carepulse.com";
    static final String DEMO_PASSWORD = "carepulse-demo";

    private final UserAccountRepository userAccountRepository;
    private final UserAccountService userAccountService;
    private final DoctorService doctorService;
    private final PatientService patientService;
    private final AppointmentService appointmentService;
    private final Clock clock;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (userAccountRepository.existsByEmail(EmailAddress.of(STAFF_EMAIL))) {
            log.info("Demo data already present, skipping seed");
            return;
        }

        userAccountService.createAccount(UserRole.STAFF, EmailAddress.of(STAFF_EMAIL),
            PhoneNumber.of("+65 6123 4567"), "Front", "Desk", DEMO_PASSWORD);

        List<Doctor> doctors = List.of(
            doctorService.create(new CreateDoctorRequest(null, DEMO_PASSWORD, "Sarah", "Chen",
                "dr.sarah.chen@carepulse.com", "General Physiotherapy", true)),
            doctorService.create(new CreateDoctorRequest(null, DEMO_PASSWORD, "James", "Wilson",
                "dr.james.wilson@carepulse.com", "Sports Physiotherapy", true)),
            doctorService.create(new CreateDoctorRequest(null, DEMO_PASSWORD, "Maria", "Rodriguez",
                "dr.maria.rodriguez@carepulse.com", "Pediatric Physiotherapy", true)));

        List<Patient> patients = List.of(
            patient("John", "Doe", "john.doe@email.com", "+65 9123 4567", LocalDate.of(1985, 3, 15)),
            patient("Emily", "Tan", "emily.tan@gmail.com", "+65 8234 5678", LocalDate.of(1992, 7, 22)),
            patient("Michael", "Lee", "michael.lee@hotmail.com", "+65 9345 6789", LocalDate.of(1978, 11, 5)),
            patient("Lisa", "Wong", "lisa.wong@yahoo.com", "+65 8456 7890", LocalDate.of(2001, 1, 30)),
            patient("David", "Kumar", "david.kumar@live.com", "+65 9567 8901", LocalDate.of(1969, 9, 12)));

        LocalDate day = nextWorkingDay(LocalDate.now(clock));
        book(patients.get(0), doctors.get(0), AppointmentType.FIRST_CONSULT, day, 9, "Lower back pain");
        book(patients.get(1), doctors.get(0), AppointmentType.FOLLOW_UP, day, 11, "Knee rehabilitation review");
        book(patients.get(2), doctors.get(1), AppointmentType.CHECK_UP, day, 10, "Shoulder mobility check");
        book(patients.get(3), doctors.get(2), AppointmentType.FIRST_CONSULT, day, 14, "Posture assessment");
        Appointment cancelled = book(patients.get(4), doctors.get(1), AppointmentType.FOLLOW_UP, day, 15,
            "Ankle sprain follow-up");
        appointmentService.transitionStatus(AppointmentId.create(cancelled.getId()), AppointmentStatus.CANCELLED);

        log.info("Seeded demo data: {} doctors, {} patients, appointments on {}", doctors.size(), patients.size(), day);
    }

    private Patient patient(String firstName, String lastName, String email, String phone, LocalDate dateOfBirth) {
        return patientService.create(new CreatePatientRequest(null, DEMO_PASSWORD, firstName, lastName,
            email, phone, dateOfBirth, null));
    }

    private Appointment book(Patient patient, Doctor doctor, AppointmentType type, LocalDate day, int hour,
                             String reason) {
        return appointmentService.create(new CreateAppointmentRequest(patient.getId(), doctor.getId(),
            type.name(), day.atTime(hour, 0), null, reason, null));
    }

    private static LocalDate nextWorkingDay(LocalDate from) {
        LocalDate day = from.plusDays(1);
        while (day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY) {
            day = day.plusDays(1);
        }
        return day;
    }
}
