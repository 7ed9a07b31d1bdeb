package com.notekeeper.api.security;

import com.notekeeper.infrastructure.user.UserEntity;
import com.notekeeper.infrastructure.user.UserRepository;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class AuthGateTest {

  private final TokenService tokens = mock(TokenService.class);
  private final UserRepository users = mock(UserRepository.class);
  private final AuthGate gate = new AuthGate(tokens, users);

  @Test
  void validTokenResolvesToTheUser() {
    var id = UUID.randomUUID();
    var created = Instant.parse("2026-01-01T00:00:00Z");
    when(tokens.validate("good")).thenReturn(Optional.of("alice"));
    when(users.findByUsername("alice"))
        .thenReturn(Optional.of(new UserEntity(id, "alice", "a@x.com", "$2a$04$hash", created)));

    var auth = gate.authenticate(new BearerTokenAuthenticationToken("good"));

    assertThat(auth).isInstanceOf(UsernamePasswordAuthenticationToken.class);
    assertThat(auth.isAuthenticated()).isTrue();
    assertThat(auth.getPrincipal()).isEqualTo(new CurrentUser(id, "alice", "a@x.com", created));
    assertThat(auth.getCredentials()).isNull();
  }

  @Test
  void invalidTokenAndMissingUserFailTheSameWay() {
    when(tokens.validate("bad")).thenReturn(Optional.empty());
    when(tokens.validate("orphan")).thenReturn(Optional.of("ghost"));
    when(users.findByUsername("ghost")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> gate.authenticate(new BearerTokenAuthenticationToken("bad")))
        .isInstanceOf(InvalidBearerTokenException.class)
        .hasMessage(AuthGate.INVALID_CREDENTIALS);
    assertThatThrownBy(() -> gate.authenticate(new BearerTokenAuthenticationToken("orphan")))
        .isInstanceOf(InvalidBearerTokenException.class)
        .hasMessage(AuthGate.INVALID_CREDENTIALS);

    verify(users, never()).findByUsername(isNull());
  }

  @Test
  void onlyBearerTokensAreSupported() {
    assertThat(gate.supports(BearerTokenAuthenticationToken.class)).isTrue();
    assertThat(gate.supports(UsernamePasswordAuthenticationToken.class)).isFalse();
  }
}
