package com.carepulse.model.clinic;

import com.carepulse.model.AuditableEntity;
import com.carepulse.model.enums.UserRole;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.model.value.EmailAddressConverter;
import com.carepulse.model.value.PhoneNumber;
import com.carepulse.model.value.PhoneNumberConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Login account behind a patient, doctor or staff member.
 * Accounts created for walk-in registrations have no password and cannot sign in.
 */
@Entity
@Table(name = "user_account", indexes = {
    @Index(name = "idx_user_email", columnList = "email", unique = true)
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class UserAccount extends AuditableEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Convert(converter = EmailAddressConverter.class)
    @Column(nullable = false, length = 255)
    private EmailAddress email;

    @Column(name = "password_hash", length = 100)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Convert(converter = PhoneNumberConverter.class)
    @Column(name = "phone_number", length = 8)
    private PhoneNumber phoneNumber;

    @Column(name = "first_name", length = 50)
    private String firstName;

    @Column(name = "last_name", length = 50)
    private String lastName;
}
