package com.notekeeper.api.auth;

import com.notekeeper.api.security.CurrentUser;
import com.notekeeper.api.security.TokenService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

  private final AuthService auth;

  public AuthController(AuthService auth) {
    this.auth = auth;
  }

  public record RegisterRequest(
      @NotBlank @Size(min = 3, max = 64) String username,
      @NotBlank @Email @Size(max = 128) String email,
      // byte length is checked again when hashing
      @NotBlank @Size(min = 8, max = 72) String password
  ) {}

  public record LoginRequest(
      @NotBlank String username,
      @NotBlank String password
  ) {}

  public record UserResponse(
      UUID id,
      String username,
      String email,
      Instant createdAt
  ) {
    static UserResponse of(CurrentUser u) {
      return new UserResponse(u.id(), u.username(), u.email(), u.createdAt());
    }
  }

  public record TokenResponse(
      String accessToken,
      String tokenType,
      long expiresInSeconds
  ) {
    static TokenResponse of(TokenService.IssuedToken t) {
      return new TokenResponse(t.value(), "bearer", t.expiresInSeconds());
    }
  }

  @PostMapping(value = "/register", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest req) {
    var user = auth.register(req.username(), req.email(), req.password());
    return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.of(user));
  }

  @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest req) {
    return ResponseEntity.ok(TokenResponse.of(auth.login(req.username(), req.password())));
  }

  /**
   * OAuth2 password-flow token endpoint: form fields {@code username} and {@code password}.
   */
  @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TokenResponse> token(@RequestParam("username") String username,
                                             @RequestParam("password") String password) {
    return ResponseEntity.ok(TokenResponse.of(auth.login(username, password)));
  }
}
