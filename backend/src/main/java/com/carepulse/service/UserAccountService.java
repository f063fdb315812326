package com.carepulse.service;

import com.carepulse.exception.ConflictException;
import com.carepulse.model.clinic.UserAccount;
import com.carepulse.model.enums.UserRole;
import com.carepulse.model.id.UserId;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.model.value.PhoneNumber;
import com.carepulse.repository.UserAccountRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Manages login accounts behind patients, doctors and staff.
 */
@Service
@Transactional
@Slf4j
public class UserAccountService {

    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;

    public UserAccountService(UserAccountRepository userAccountRepository, PasswordEncoder passwordEncoder) {
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Create an account. A null password yields an account that cannot sign in.
     *
     * @throws ConflictException if the email is already registered
     */
    public UserAccount createAccount(UserRole role, EmailAddress email, PhoneNumber phone,
                                     String firstName, String lastName, String rawPassword) {
        if (userAccountRepository.existsByEmail(email)) {
            throw new ConflictException("An account with email " + email + " already exists");
        }

        UserAccount account = UserAccount.builder()
            .id(UserId.create().value())
            .email(email)
            .phoneNumber(phone)
            .role(role)
            .firstName(firstName)
            .lastName(lastName)
            .passwordHash(rawPassword != null ? passwordEncoder.encode(rawPassword) : null)
            .build();

        UserAccount saved = userAccountRepository.save(account);
        log.info("Created {} account {}", role, saved.getId());
        return saved;
    }

    /**
     * Load an existing account and check it has the expected role.
     */
    @Transactional(readOnly = true)
    public UserAccount requireAccount(UserId id, UserRole expectedRole) {
        UserAccount account = userAccountRepository.findById(id.value())
            .orElseThrow(() -> new EntityNotFoundException("User not found: " + id));
        if (account.getRole() != expectedRole) {
            throw new ConflictException("User " + id + " has role " + account.getRole()
                + ", expected " + expectedRole);
        }
        return account;
    }

    /**
     * Remove the account behind a deleted patient or doctor record.
     */
    public void deleteAccount(String userId) {
        userAccountRepository.findById(userId).ifPresent(account -> {
            userAccountRepository.delete(account);
            log.info("Deleted {} account {}", account.getRole(), account.getId());
        });
    }
}
