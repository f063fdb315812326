package com.carepulse.security;

import com.carepulse.exception.InvalidFormatException;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads user accounts by email for HTTP Basic authentication.
 */
@Service
@RequiredArgsConstructor
public class ClinicUserDetailsService implements UserDetailsService {

    private final UserAccountRepository userAccountRepository;

    @Override
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String username) {
        EmailAddress email;
        try {
            email = EmailAddress.of(username);
        } catch (InvalidFormatException e) {
            throw new UsernameNotFoundException("Unknown user: " + username, e);
        }
        return userAccountRepository.findByEmail(email)
            .map(ClinicUserDetails::new)
            .orElseThrow(() -> new UsernameNotFoundException("Unknown user: " + username));
    }
}
