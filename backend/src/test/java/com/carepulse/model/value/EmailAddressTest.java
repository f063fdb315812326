package com.carepulse.model.value;

import com.carepulse.exception.InvalidFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmailAddressTest {

    @Test
    void emailIsLowerCased() {
        EmailAddress email = EmailAddress.of("John.Doe@Example.COM");

        assertThat(email.getValue()).isEqualTo("john.doe@example.com");
        assertThat(email.getUsername()).isEqualTo("john.doe");
        assertThat(email.getDomain()).isEqualTo("example.com");
    }

    @ParameterizedTest
    @ValueSource(strings = {"plainaddress", "missing@tld", "@nouser.com", "two@@at.com", "spa ce@x.com", ""})
    void malformedEmailsAreRejected(String input) {
        assertThatThrownBy(() -> EmailAddress.of(input))
            .isInstanceOf(InvalidFormatException.class)
            .hasMessageContaining("Invalid email format");
    }

    @Test
    void equalityIgnoresCase() {
        assertThat(EmailAddress.of("A@B.co")).isEqualTo(EmailAddress.of("a@b.co"));
        assertThat(EmailAddress.of("A@B.co")).hasSameHashCodeAs(EmailAddress.of("a@b.co"));
    }
}
