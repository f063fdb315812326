package com.carepulse.model.clinic;

import com.carepulse.model.AuditableEntity;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.model.value.EmailAddressConverter;
import com.carepulse.model.value.PhoneNumber;
import com.carepulse.model.value.PhoneNumberConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.LocalDate;

/**
 * Registered patient. Owned 1:1 by a {@link UserAccount}.
 */
@Entity
@Table(name = "patient", indexes = {
    @Index(name = "idx_patient_user", columnList = "user_id", unique = true),
    @Index(name = "idx_patient_email", columnList = "email", unique = true),
    @Index(name = "idx_patient_phone", columnList = "phone", unique = true)
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class Patient extends AuditableEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_patient_user"))
    private UserAccount account;

    @Column(name = "first_name", nullable = false, length = 50)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;

    @Convert(converter = EmailAddressConverter.class)
    @Column(nullable = false, length = 255)
    private EmailAddress email;

    @Convert(converter = PhoneNumberConverter.class)
    @Column(nullable = false, length = 8)
    private PhoneNumber phone;

    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    @Column(columnDefinition = "TEXT")
    private String address;

    public String getFullName() {
        return firstName + " " + lastName;
    }
}
