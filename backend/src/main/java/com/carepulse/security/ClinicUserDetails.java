package com.carepulse.security;

import com.carepulse.model.clinic.UserAccount;
import lombok.Getter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.List;

/**
 * Spring Security view of a {@link UserAccount}. Username is the email.
 */
@Getter
public class ClinicUserDetails implements UserDetails {

    private final ClinicPrincipal principal;
    private final String password;

    public ClinicUserDetails(UserAccount account) {
        this.principal = new ClinicPrincipal(
            account.getId(),
            account.getRole(),
            account.getEmail().getValue(),
            account.getPhoneNumber() != null ? account.getPhoneNumber().getValue() : null);
        this.password = account.getPasswordHash();
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name()));
    }

    @Override
    public String getUsername() {
        return principal.email();
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return true;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    /**
     * Accounts without a password hash were created for walk-in registrations
     * and cannot sign in.
     */
    @Override
    public boolean isEnabled() {
        return password != null;
    }
}
