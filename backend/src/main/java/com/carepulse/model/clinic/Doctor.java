package com.carepulse.model.clinic;

import com.carepulse.model.AuditableEntity;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.model.value.EmailAddressConverter;
import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Entity
@Table(name = "doctor", indexes = {
    @Index(name = "idx_doctor_user", columnList = "user_id", unique = true),
    @Index(name = "idx_doctor_email", columnList = "email", unique = true),
    @Index(name = "idx_doctor_active", columnList = "active")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class Doctor extends AuditableEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_doctor_user"))
    private UserAccount account;

    @Column(name = "first_name", nullable = false, length = 50)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;

    @Convert(converter = EmailAddressConverter.class)
    @Column(nullable = false, length = 255)
    private EmailAddress email;

    /**
     * Free text, e.g. "Physiotherapy".
     */
    @Column(length = 100)
    private String specialization;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    public String getDisplayName() {
        return "Dr. " + firstName + " " + lastName;
    }
}
